package com.example.astromech.core;

/**
 * Base type of the exceptions raised by this library itself.
 *
 * <p>Failures reported by the AWS SDK ({@code SdkException} and its subclasses) are never wrapped
 * in this type; they reach the caller untouched.
 */
public class AstromechException extends RuntimeException {

  public AstromechException(final String message) {
    super(message);
  }

  public AstromechException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
