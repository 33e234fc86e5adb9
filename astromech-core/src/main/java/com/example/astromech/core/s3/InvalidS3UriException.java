package com.example.astromech.core.s3;

/** Raised when a string is not an {@code s3://bucket/key} URI. */
public class InvalidS3UriException extends IllegalArgumentException {

  public InvalidS3UriException(final String uri) {
    super("Not a S3 URI: " + uri);
  }
}
