package com.example.astromech.core;

import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import com.example.astromech.core.client.ClientFactory;
import com.example.astromech.core.config.Environment;
import com.example.astromech.core.dynamodb.DynamoDbHelper;
import com.example.astromech.core.logging.LogLevels;
import com.example.astromech.core.s3.S3Helper;
import com.example.astromech.core.sns.SnsHelper;
import com.example.astromech.core.sqs.SqsHelper;
import com.example.astromech.core.ssm.SsmHelper;
import com.fasterxml.jackson.databind.ObjectMapper;
import software.amazon.awssdk.core.SdkClient;

/**
 * Entry point of the library: one {@link ClientCache} and the service helpers sharing it.
 *
 * <p>Create one instance per Lambda container and keep it in a static field, so that the clients
 * survive between invocations:
 *
 * <pre>{@code
 * public class Handler implements RequestHandler<SQSEvent, Void> {
 *   private static final Astromech AWS = Astromech.create();
 *
 *   public Void handleRequest(final SQSEvent event, final Context context) {
 *     AWS.sqs().parseEvent(event).forEach(message -> AWS.sns().publishToBus(context, message));
 *     return null;
 *   }
 * }
 * }</pre>
 *
 * <p>Building an instance applies {@code LOG_LEVEL}; no client is created until first used.
 */
public final class Astromech implements AutoCloseable {

  private final Environment environment;
  private final ClientCache clients;
  private final DynamoDbHelper dynamoDb;
  private final S3Helper s3;
  private final SnsHelper sns;
  private final SqsHelper sqs;
  private final SsmHelper ssm;

  private Astromech(final Builder builder) {
    this.environment = builder.environment;
    this.clients = builder.clients.environment(builder.environment).build();
    this.dynamoDb = new DynamoDbHelper(clients, environment);
    this.s3 = new S3Helper(clients, environment);
    this.sns = new SnsHelper(clients, environment, builder.mapper);
    this.sqs = new SqsHelper(clients, builder.mapper);
    this.ssm = new SsmHelper(clients);
  }

  /**
   * Creates an instance configured from system properties and environment variables.
   *
   * @return new instance
   */
  public static Astromech create() {
    return builder().build();
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public Environment environment() {
    return environment;
  }

  public ClientCache clients() {
    return clients;
  }

  public DynamoDbHelper dynamoDb() {
    return dynamoDb;
  }

  public S3Helper s3() {
    return s3;
  }

  public SnsHelper sns() {
    return sns;
  }

  public SqsHelper sqs() {
    return sqs;
  }

  public SsmHelper ssm() {
    return ssm;
  }

  /** Closes every cached client. */
  @Override
  public void close() {
    clients.close();
  }

  /** Builder for {@link Astromech}. */
  public static class Builder {
    private Environment environment = Environment.system();
    private ObjectMapper mapper = new ObjectMapper();
    private final ClientCache.Builder clients = ClientCache.builder();

    private Builder() {}

    /**
     * Sets where settings are read from.
     *
     * <p>Default: {@link Environment#system()}
     *
     * @param environment settings source
     * @return this builder
     */
    public Builder environment(final Environment environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Sets the mapper used to write SNS payloads and read SQS bodies.
     *
     * <p>Default: a plain {@link ObjectMapper}
     *
     * @param mapper JSON mapper
     * @return this builder
     */
    public Builder objectMapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * Replaces the way one service's client is built.
     *
     * @param service the service
     * @param factory builds the client from the resolved endpoint override
     * @param <T> client type
     * @return this builder
     * @see ClientCache.Builder#clientFactory(AwsService, ClientFactory)
     */
    public <T extends SdkClient> Builder clientFactory(
        final AwsService<T> service, final ClientFactory<? extends T> factory) {
      this.clients.clientFactory(service, factory);
      return this;
    }

    /**
     * Applies {@code LOG_LEVEL} and builds the instance.
     *
     * @return configured instance
     * @throws IllegalStateException if required fields are not set
     * @throws com.example.astromech.core.config.ConfigurationException if {@code LOG_LEVEL} is
     *     invalid
     */
    public Astromech build() {
      if (environment == null) throw new IllegalStateException("environment is required");
      if (mapper == null) throw new IllegalStateException("objectMapper is required");
      LogLevels.configure(environment);
      return new Astromech(this);
    }
  }
}
