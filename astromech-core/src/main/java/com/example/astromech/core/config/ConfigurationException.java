package com.example.astromech.core.config;

import com.example.astromech.core.AstromechException;

/**
 * Raised when a required setting is neither passed explicitly nor available from the {@link
 * Environment}, or when a setting holds a value that cannot be used.
 */
public class ConfigurationException extends AstromechException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Builds the exception reported for a missing variable.
   *
   * @param variable the environment variable name
   * @return exception naming the variable
   */
  public static ConfigurationException missing(final String variable) {
    return new ConfigurationException(
        "Missing value: set the environment variable \"%s\" or pass it explicitly"
            .formatted(variable));
  }
}
