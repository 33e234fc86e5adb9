package com.example.astromech.core.s3;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import java.lang.System.Logger;
import java.util.Map;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3 access for Lambda functions: cached client, URI and default path helpers, and object
 * operations.
 *
 * <p>Configuration:
 *
 * <ul>
 *   <li>S3_BUCKET: bucket used by {@link #defaultPath} when none is passed
 *   <li>S3_KEY_PREFIX: optional key prefix used by {@link #defaultPath}
 *   <li>LOCALSTACK_S3_URL: endpoint override
 * </ul>
 *
 * <p>Apart from {@link #exists}, every operation lets SDK exceptions propagate.
 */
public class S3Helper {

  private static final Logger logger = System.getLogger(S3Helper.class.getName());

  public static final String BUCKET_VARIABLE = "S3_BUCKET";
  public static final String KEY_PREFIX_VARIABLE = "S3_KEY_PREFIX";
  public static final String DEFAULT_ACL = "private";

  private final ClientCache cache;
  private final Environment environment;

  public S3Helper(final ClientCache cache, final Environment environment) {
    this.cache = cache;
    this.environment = environment;
  }

  /** Returns the cached S3 client, creating it on first use. */
  public S3Client client() {
    return cache.getClient(AwsService.S3);
  }

  /**
   * Parses an {@code s3://bucket/key} URI.
   *
   * @see S3Uri#parse(String)
   */
  public static S3Uri parseUri(final String uri) {
    return S3Uri.parse(uri);
  }

  /**
   * Builds an {@code s3://bucket/key} URI.
   *
   * @param bucket bucket name
   * @param key object key
   * @return the URI string
   */
  public static String toUri(final String bucket, final String key) {
    return S3Uri.of(bucket, key).toUri();
  }

  /**
   * Resolves the default location of a file from {@code S3_BUCKET} and {@code S3_KEY_PREFIX}.
   *
   * @param filename file name, used as key suffix
   * @return the location
   * @throws ConfigurationException if {@code S3_BUCKET} is not set
   */
  public S3Uri defaultPath(final String filename) {
    return defaultPath(filename, null, null);
  }

  /**
   * Resolves the location of a file.
   *
   * <p>The bucket comes from {@code bucket}, else {@code S3_BUCKET}; it is required. The key prefix
   * comes from {@code keyPrefix}, else {@code S3_KEY_PREFIX}; it is optional, and a prefix made of
   * slashes only counts as none. With a prefix, the key is the prefix without surrounding slashes,
   * a {@code /}, and the filename without leading slashes. Without one, the key is the filename
   * without leading slashes.
   *
   * @param filename file name, used as key suffix
   * @param bucket bucket name, or {@code null} to use the environment
   * @param keyPrefix key prefix, or {@code null} to use the environment
   * @return the location
   * @throws ConfigurationException if no bucket can be resolved
   */
  public S3Uri defaultPath(final String filename, final String bucket, final String keyPrefix) {
    final var resolvedBucket =
        environment
            .resolve(bucket, BUCKET_VARIABLE)
            .orElseThrow(() -> ConfigurationException.missing(BUCKET_VARIABLE));
    final var name = S3Uri.stripLeadingSlashes(filename);
    final var key =
        environment
            .resolve(keyPrefix, KEY_PREFIX_VARIABLE)
            .map(S3Uri::stripSlashes)
            .filter(prefix -> !prefix.isEmpty())
            .map(prefix -> prefix + "/" + name)
            .orElse(name);
    return S3Uri.of(resolvedBucket, key);
  }

  /**
   * Checks whether an object exists. Only works for objects, not for key prefixes.
   *
   * <p>Any error returned by S3 counts as absent, so a missing permission also yields {@code
   * false}. Client-side failures (network, credentials) still propagate.
   *
   * @param bucket bucket name
   * @param key object key
   * @return {@code true} if a HeadObject request on the key succeeds
   */
  public boolean exists(final String bucket, final String key) {
    try {
      client().headObject(headRequest(bucket, key));
      return true;
    } catch (final S3Exception e) {
      logger.log(DEBUG, "HeadObject on s3://{0}/{1} failed: {2}", bucket, key, e.statusCode());
      return false;
    }
  }

  public boolean exists(final S3Uri location) {
    return exists(location.bucket(), location.key());
  }

  /**
   * Returns the size of an object.
   *
   * @param bucket bucket name
   * @param key object key
   * @return size in bytes
   */
  public long getSize(final String bucket, final String key) {
    return client().headObject(headRequest(bucket, key)).contentLength();
  }

  public long getSize(final S3Uri location) {
    return getSize(location.bucket(), location.key());
  }

  /**
   * Reads an object into memory.
   *
   * @param bucket bucket name
   * @param key object key
   * @return the object content
   */
  public byte[] getBytes(final String bucket, final String key) {
    logger.log(DEBUG, "Reading from s3://{0}/{1}", bucket, key);
    final var request = GetObjectRequest.builder().bucket(bucket).key(key).build();
    return client().getObjectAsBytes(request).asByteArray();
  }

  public byte[] getBytes(final S3Uri location) {
    return getBytes(location.bucket(), location.key());
  }

  /**
   * Reads the tags of an object.
   *
   * @param bucket bucket name
   * @param key object key
   * @return tag key to value, empty if the object has no tags
   */
  public Map<String, String> getTags(final String bucket, final String key) {
    logger.log(DEBUG, "Reading tags from s3://{0}/{1}", bucket, key);
    final var request = GetObjectTaggingRequest.builder().bucket(bucket).key(key).build();
    return TagSets.toMap(client().getObjectTagging(request).tagSet());
  }

  public Map<String, String> getTags(final S3Uri location) {
    return getTags(location.bucket(), location.key());
  }

  /**
   * Writes a buffer as a private, untagged object.
   *
   * @see #putBytes(byte[], String, String, Map, String)
   */
  public PutResult putBytes(final byte[] buffer, final String bucket, final String key) {
    return putBytes(buffer, bucket, key, Map.of(), DEFAULT_ACL);
  }

  /**
   * Writes a buffer as a private object.
   *
   * @see #putBytes(byte[], String, String, Map, String)
   */
  public PutResult putBytes(
      final byte[] buffer, final String bucket, final String key, final Map<String, String> tags) {
    return putBytes(buffer, bucket, key, tags, DEFAULT_ACL);
  }

  /**
   * Writes a buffer to S3 in a single PutObject request.
   *
   * <p>Tag keys and values may contain letters, digits, whitespace and {@code + - = . _ : /}. The
   * buffer is sent as is; large payloads must be split by the caller.
   *
   * @param buffer content
   * @param bucket target bucket
   * @param key target key
   * @param tags tags to set on the object
   * @param acl canned ACL, e.g. {@code private} or {@code bucket-owner-full-control}
   * @return the bucket, the key and the number of bytes written
   */
  public PutResult putBytes(
      final byte[] buffer,
      final String bucket,
      final String key,
      final Map<String, String> tags,
      final String acl) {
    logger.log(DEBUG, "Writing {0} bytes to s3://{1}/{2}", buffer.length, bucket, key);
    final var request =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .tagging(TagSets.toTagging(tags))
            .acl(acl)
            .build();
    client().putObject(request, RequestBody.fromBytes(buffer));
    return new PutResult(bucket, key, buffer.length);
  }

  public PutResult putBytes(final byte[] buffer, final S3Uri location) {
    return putBytes(buffer, location.bucket(), location.key());
  }

  private static HeadObjectRequest headRequest(final String bucket, final String key) {
    return HeadObjectRequest.builder().bucket(bucket).key(key).build();
  }
}
