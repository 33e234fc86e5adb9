package com.example.astromech.core.s3;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class S3UriTest {

  @Test
  void parsesBucketAndKey() {
    final var uri = S3Uri.parse("s3://my-bucket/path/to/object.txt");
    assertEquals("my-bucket", uri.bucket());
    assertEquals("path/to/object.txt", uri.key());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "s3://bucket/key",
        "s3://bucket/dir/sub/file.json",
        "s3://bucket/with space/and+plus.txt",
        "s3://bucket/"
      })
  @DisplayName("parse then format round-trips for keys without leading slashes")
  void roundTrips(final String uri) {
    assertEquals(uri, S3Uri.parse(uri).toUri());
  }

  @Test
  void stripsLeadingSlashesFromKey() {
    assertEquals("key/x", S3Uri.parse("s3://bucket///key/x").key());
  }

  @Test
  void bucketOnlyHasEmptyKey() {
    assertEquals(S3Uri.of("bucket", ""), S3Uri.parse("s3://bucket"));
  }

  @Test
  void queryAndFragmentAreNotPartOfTheKey() {
    assertEquals("dir/file", S3Uri.parse("s3://bucket/dir/file?versionId=3").key());
    assertEquals("dir/file", S3Uri.parse("s3://bucket/dir/file#part").key());
  }

  @Test
  void schemeIsCaseInsensitive() {
    assertEquals(S3Uri.of("bucket", "key"), S3Uri.parse("S3://bucket/key"));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://bucket/key",
        "s4://bucket/key",
        "bucket/key",
        "/bucket/key",
        "s3:/bucket/key",
        "s3:///key",
        ""
      })
  void rejectsNonS3Uris(final String uri) {
    assertThrows(InvalidS3UriException.class, () -> S3Uri.parse(uri));
  }

  @Test
  void invalidUriIsAnIllegalArgument() {
    final var error = assertThrows(IllegalArgumentException.class, () -> S3Uri.parse("gs://b/k"));
    assertTrue(error.getMessage().contains("gs://b/k"));
  }

  @Test
  void toStringIsTheUri() {
    assertEquals("s3://b/k", S3Uri.of("b", "k").toString());
    assertEquals("s3://b/k", S3Helper.toUri("b", "k"));
  }

  @Test
  void rejectsEmptyBucket() {
    assertThrows(IllegalArgumentException.class, () -> S3Uri.of("", "key"));
  }

  @Test
  void slashStripping() {
    assertEquals("dir", S3Uri.stripSlashes("//dir//"));
    assertEquals("a/b", S3Uri.stripSlashes("a/b"));
    assertEquals("", S3Uri.stripSlashes("///"));
    assertEquals("file/", S3Uri.stripLeadingSlashes("/file/"));
  }
}
