package com.example.astromech.core.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the named settings a Lambda function is configured with.
 *
 * <p>{@link #system()} looks a name up as a system property first and then as an environment
 * variable. The property name is the variable name in lower case with underscores replaced by dots,
 * so {@code LOCALSTACK_S3_URL} can also be given as {@code -Dlocalstack.s3.url=...}.
 *
 * <p>Blank values are treated as absent.
 */
@FunctionalInterface
public interface Environment {

  /**
   * Looks up a setting.
   *
   * @param name the environment variable name, e.g. {@code S3_BUCKET}
   * @return the value, or empty when unset or blank
   */
  Optional<String> get(final String name);

  /**
   * Looks up a setting that must be present.
   *
   * @param name the environment variable name
   * @return the value
   * @throws ConfigurationException if the setting is unset or blank
   */
  default String require(final String name) {
    return get(name).orElseThrow(() -> ConfigurationException.missing(name));
  }

  /**
   * Returns {@code explicit} when it is not blank, otherwise the named setting.
   *
   * @param explicit value passed by the caller, may be {@code null}
   * @param name the environment variable name used as fallback
   * @return the resolved value, or empty when neither source has one
   */
  default Optional<String> resolve(final String explicit, final String name) {
    return Optional.ofNullable(explicit).filter(value -> !value.isBlank()).or(() -> get(name));
  }

  /**
   * Environment backed by system properties and the process environment.
   *
   * @return the process environment
   */
  static Environment system() {
    return name ->
        Optional.ofNullable(System.getProperty(propertyName(name)))
            .filter(value -> !value.isBlank())
            .or(() -> Optional.ofNullable(System.getenv(name)).filter(value -> !value.isBlank()));
  }

  /**
   * Environment reading through the given map. Changes to the map are visible to later lookups.
   *
   * @param values variable name to value
   * @return map backed environment
   */
  static Environment of(final Map<String, String> values) {
    return name -> Optional.ofNullable(values.get(name)).filter(value -> !value.isBlank());
  }

  /**
   * Maps a variable name to its system property alias.
   *
   * @param name the environment variable name
   * @return the system property name
   */
  static String propertyName(final String name) {
    return name.toLowerCase(Locale.ROOT).replace('_', '.');
  }
}
