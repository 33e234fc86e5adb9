package com.example;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.example.astromech.core.Astromech;
import com.example.astromech.core.s3.S3Uri;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.System.Logger;
import java.util.LinkedHashMap;

/**
 * Demo Lambda function relaying queue messages to S3 and the message bus.
 *
 * <p>Each message body is decoded, stored as {@code <messageId>.json} under {@code S3_BUCKET} and
 * {@code S3_KEY_PREFIX}, and announced on {@code MESSAGE_BUS_ARN}. Once the announcement is
 * published, an empty {@code <messageId>.json.published} marker is written next to the object.
 * Redeliveries of a message with a marker are skipped; without one the message is stored and
 * announced again, so a failed publish is retried on the next delivery.
 */
public class App implements RequestHandler<SQSEvent, Void> {

  private static final Logger logger = System.getLogger(App.class.getName());

  static final String PUBLISHED_SUFFIX = ".published";

  private final Astromech aws;
  private final ObjectMapper mapper = new ObjectMapper();

  /** Constructor used by the Lambda runtime; shares one {@link Astromech} per container. */
  public App() {
    this(Shared.AWS);
  }

  /**
   * Constructs the function on top of the given clients.
   *
   * @param aws clients and helpers to use
   */
  public App(final Astromech aws) {
    this.aws = aws;
  }

  @Override
  public Void handleRequest(final SQSEvent event, final Context context) {
    for (final var message : event.getRecords()) relay(message, context);
    return null;
  }

  /**
   * Stores one message, announces it, then marks it as relayed.
   *
   * @param message queue message
   * @param context context of the running function
   * @return the location of the stored message, whether written now or before
   */
  S3Uri relay(final SQSEvent.SQSMessage message, final Context context) {
    final var location = aws.s3().defaultPath(message.getMessageId() + ".json");
    final var marker = publishedMarker(location);
    if (aws.s3().exists(marker)) {
      logger.log(INFO, "Message {0} already relayed to {1}", message.getMessageId(), location);
      return location;
    }

    final var value = aws.sqs().parseBody(message.getBody());
    aws.s3().putBytes(toJson(value), location);

    final var notification = new LinkedHashMap<String, Object>();
    notification.put("messageId", message.getMessageId());
    notification.put("location", location.toUri());
    final var published = aws.sns().publishToBus(context, notification);
    aws.s3().putBytes(new byte[0], marker);
    logger.log(DEBUG, "Relayed {0} as {1}", message.getMessageId(), published);
    return location;
  }

  static S3Uri publishedMarker(final S3Uri location) {
    return S3Uri.of(location.bucket(), location.key() + PUBLISHED_SUFFIX);
  }

  private byte[] toJson(final Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Decoded message is not serializable", e);
    }
  }

  /** Lazily created so that tests can build the function without touching the environment. */
  private static final class Shared {
    static final Astromech AWS = Astromech.create();
  }
}
