package com.example.astromech.core.client;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.core.client.builder.SdkClientBuilder;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.ssm.SsmClient;

/**
 * Describes one AWS service whose client is cached by {@link ClientCache}: the cache slot, the
 * environment variable holding an endpoint override and the default way to build the client.
 *
 * <p>Region and credentials are not configured here. The SDK default provider chains pick them up
 * ({@code AWS_REGION} is always set inside Lambda).
 *
 * @param <T> client type
 */
public final class AwsService<T extends SdkClient> {

  public static final AwsService<DynamoDbClient> DYNAMODB =
      new AwsService<>(
          "dynamodb",
          "LOCALSTACK_DYNAMODB_URL",
          DynamoDbClient.class,
          endpoint -> withEndpoint(DynamoDbClient.builder(), endpoint).build());

  /** S3 switches to path-style addressing when an endpoint override is set. */
  public static final AwsService<S3Client> S3 =
      new AwsService<>(
          "s3",
          "LOCALSTACK_S3_URL",
          S3Client.class,
          endpoint ->
              withEndpoint(S3Client.builder(), endpoint)
                  .forcePathStyle(endpoint.isPresent())
                  .build());

  public static final AwsService<SnsClient> SNS =
      new AwsService<>(
          "sns",
          "LOCALSTACK_SNS_URL",
          SnsClient.class,
          endpoint -> withEndpoint(SnsClient.builder(), endpoint).build());

  public static final AwsService<SqsClient> SQS =
      new AwsService<>(
          "sqs",
          "LOCALSTACK_SQS_URL",
          SqsClient.class,
          endpoint -> withEndpoint(SqsClient.builder(), endpoint).build());

  public static final AwsService<SsmClient> SSM =
      new AwsService<>(
          "ssm",
          "LOCALSTACK_SSM_URL",
          SsmClient.class,
          endpoint -> withEndpoint(SsmClient.builder(), endpoint).build());

  private final String slot;
  private final String endpointVariable;
  private final Class<T> clientType;
  private final ClientFactory<T> defaultFactory;

  private AwsService(
      final String slot,
      final String endpointVariable,
      final Class<T> clientType,
      final ClientFactory<T> defaultFactory) {
    this.slot = slot;
    this.endpointVariable = endpointVariable;
    this.clientType = clientType;
    this.defaultFactory = defaultFactory;
  }

  /**
   * All services known to the library.
   *
   * @return the services, in declaration order
   */
  public static List<AwsService<?>> values() {
    return List.of(DYNAMODB, S3, SNS, SQS, SSM);
  }

  /** Cache slot holding this service's client. */
  public String slot() {
    return slot;
  }

  /** Environment variable that overrides the service endpoint, e.g. for LocalStack. */
  public String endpointVariable() {
    return endpointVariable;
  }

  public Class<T> clientType() {
    return clientType;
  }

  ClientFactory<T> defaultFactory() {
    return defaultFactory;
  }

  private static <B extends SdkClientBuilder<B, ?>> B withEndpoint(
      final B builder, final Optional<URI> endpoint) {
    endpoint.ifPresent(builder::endpointOverride);
    return builder;
  }

  @Override
  public String toString() {
    return slot;
  }
}
