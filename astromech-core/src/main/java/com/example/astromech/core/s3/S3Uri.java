package com.example.astromech.core.s3;

import java.util.Locale;
import java.util.Objects;

/**
 * Location of an S3 object.
 *
 * @param bucket bucket name, never empty
 * @param key object key
 */
public record S3Uri(String bucket, String key) {

  public static final String SCHEME = "s3";

  public S3Uri {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(key, "key");
    if (bucket.isEmpty()) throw new IllegalArgumentException("bucket must not be empty");
  }

  /**
   * Creates a location from its parts.
   *
   * @param bucket bucket name
   * @param key object key
   * @return the location
   */
  public static S3Uri of(final String bucket, final String key) {
    return new S3Uri(bucket, key);
  }

  /**
   * Parses an {@code s3://bucket/key} URI.
   *
   * <p>The bucket is the authority part; the key is the path with its leading slashes removed.
   * Query and fragment are not part of the key. The scheme is matched case-insensitively.
   *
   * @param uri the URI
   * @return the parsed location
   * @throws InvalidS3UriException if the scheme is not {@code s3} or the bucket is missing
   */
  public static S3Uri parse(final String uri) {
    Objects.requireNonNull(uri, "uri");
    final var colon = uri.indexOf(':');
    if (colon <= 0 || !SCHEME.equals(uri.substring(0, colon).toLowerCase(Locale.ROOT)))
      throw new InvalidS3UriException(uri);

    var rest = uri.substring(colon + 1);
    final var end = indexOfAny(rest, "?#");
    if (end >= 0) rest = rest.substring(0, end);
    if (!rest.startsWith("//")) throw new InvalidS3UriException(uri);

    rest = rest.substring(2);
    final var slash = rest.indexOf('/');
    final var bucket = slash < 0 ? rest : rest.substring(0, slash);
    final var path = slash < 0 ? "" : rest.substring(slash);
    if (bucket.isEmpty()) throw new InvalidS3UriException(uri);
    return new S3Uri(bucket, stripLeadingSlashes(path));
  }

  /**
   * Formats the location as {@code s3://bucket/key}.
   *
   * @return the URI string
   */
  public String toUri() {
    return SCHEME + "://" + bucket + "/" + key;
  }

  @Override
  public String toString() {
    return toUri();
  }

  static String stripLeadingSlashes(final String value) {
    var start = 0;
    while (start < value.length() && value.charAt(start) == '/') start++;
    return value.substring(start);
  }

  static String stripSlashes(final String value) {
    var end = value.length();
    while (end > 0 && value.charAt(end - 1) == '/') end--;
    return stripLeadingSlashes(value.substring(0, end));
  }

  private static int indexOfAny(final String value, final String chars) {
    for (var i = 0; i < value.length(); i++) {
      if (chars.indexOf(value.charAt(i)) >= 0) return i;
    }
    return -1;
  }
}
