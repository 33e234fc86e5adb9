package com.example.astromech.core.s3;

/**
 * Outcome of {@link S3Helper#putBytes}.
 *
 * @param bucket target bucket
 * @param key target key
 * @param length number of bytes written
 */
public record PutResult(String bucket, String key, long length) {

  public S3Uri location() {
    return S3Uri.of(bucket, key);
  }
}
