package com.example.astromech.core.sns;

import static java.lang.System.Logger.Level.DEBUG;

import com.amazonaws.services.lambda.runtime.Context;
import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.System.Logger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;

/**
 * SNS access for Lambda functions: cached client and publishing with sender attributes.
 *
 * <p>Every message carries a {@code sender} and a {@code sender_version} attribute holding the
 * function name and version from the Lambda {@link Context}.
 *
 * <p>Configuration:
 *
 * <ul>
 *   <li>MESSAGE_BUS_ARN: topic used by {@link #publishToBus}
 *   <li>LOCALSTACK_SNS_URL: endpoint override
 * </ul>
 */
public class SnsHelper {

  private static final Logger logger = System.getLogger(SnsHelper.class.getName());

  public static final String MESSAGE_BUS_VARIABLE = "MESSAGE_BUS_ARN";
  public static final String SENDER_ATTRIBUTE = "sender";
  public static final String SENDER_VERSION_ATTRIBUTE = "sender_version";

  private final ClientCache cache;
  private final Environment environment;
  private final ObjectMapper mapper;

  public SnsHelper(
      final ClientCache cache, final Environment environment, final ObjectMapper mapper) {
    this.cache = cache;
    this.environment = environment;
    this.mapper = mapper;
  }

  /** Returns the cached SNS client, creating it on first use. */
  public SnsClient client() {
    return cache.getClient(AwsService.SNS);
  }

  /**
   * Publishes a message with the default attributes and subject.
   *
   * @see #publish(String, Context, Object, Map, String)
   */
  public String publish(final String topicArn, final Context context, final Object payload) {
    return publish(topicArn, context, payload, Map.of(), null);
  }

  /**
   * Publishes a message with the default subject.
   *
   * @see #publish(String, Context, Object, Map, String)
   */
  public String publish(
      final String topicArn,
      final Context context,
      final Object payload,
      final Map<String, MessageAttributeValue> extraAttributes) {
    return publish(topicArn, context, payload, extraAttributes, null);
  }

  /**
   * Publishes a message to a topic.
   *
   * @param topicArn target topic
   * @param context context of the running function
   * @param payload message body, serialized to JSON
   * @param extraAttributes attributes added to, or replacing, {@code sender} and {@code
   *     sender_version}
   * @param subject message subject; {@code null} means {@code "Message from <function name>"}
   * @return the message id assigned by SNS
   * @throws IllegalArgumentException if the payload cannot be serialized to JSON
   */
  public String publish(
      final String topicArn,
      final Context context,
      final Object payload,
      final Map<String, MessageAttributeValue> extraAttributes,
      final String subject) {
    final var request =
        PublishRequest.builder()
            .topicArn(topicArn)
            .subject(
                Optional.ofNullable(subject)
                    .filter(s -> !s.isBlank())
                    .orElseGet(() -> "Message from " + context.getFunctionName()))
            .message(toJson(payload))
            .messageAttributes(attributes(context, extraAttributes))
            .build();
    logger.log(DEBUG, "Publishing message: {0} to topic: {1}", request.message(), topicArn);
    final var messageId = client().publish(request).messageId();
    logger.log(DEBUG, "Message published. Message id: {0}", messageId);
    return messageId;
  }

  /**
   * Publishes to the application message bus with the default attributes and subject.
   *
   * @see #publishToBus(Context, Object, Map, String)
   */
  public String publishToBus(final Context context, final Object payload) {
    return publishToBus(context, payload, Map.of(), null);
  }

  /**
   * Publishes to the topic named by {@code MESSAGE_BUS_ARN}.
   *
   * @param context context of the running function
   * @param payload message body, serialized to JSON
   * @param extraAttributes attributes added to, or replacing, the defaults
   * @param subject message subject, or {@code null} for the default
   * @return the message id assigned by SNS
   * @throws ConfigurationException if {@code MESSAGE_BUS_ARN} is not set
   */
  public String publishToBus(
      final Context context,
      final Object payload,
      final Map<String, MessageAttributeValue> extraAttributes,
      final String subject) {
    final var topicArn = environment.require(MESSAGE_BUS_VARIABLE);
    return publish(topicArn, context, payload, extraAttributes, subject);
  }

  /**
   * Builds the attributes of a message: the sender defaults, then the extra attributes on top.
   *
   * @param context context of the running function
   * @param extraAttributes caller attributes, winning on name collisions
   * @return the merged attributes
   */
  public static Map<String, MessageAttributeValue> attributes(
      final Context context, final Map<String, MessageAttributeValue> extraAttributes) {
    final var attributes = new LinkedHashMap<String, MessageAttributeValue>();
    attributes.put(SENDER_ATTRIBUTE, stringAttribute(context.getFunctionName()));
    attributes.put(SENDER_VERSION_ATTRIBUTE, stringAttribute(context.getFunctionVersion()));
    attributes.putAll(extraAttributes);
    return attributes;
  }

  /**
   * Creates an attribute of data type {@code String}.
   *
   * @param value attribute value
   * @return the attribute
   */
  public static MessageAttributeValue stringAttribute(final String value) {
    return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
  }

  private String toJson(final Object payload) {
    try {
      return mapper.writeValueAsString(payload);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Payload is not JSON-serializable", e);
    }
  }
}
