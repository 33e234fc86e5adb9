package com.example.astromech.core.sqs;

import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * SQS access for Lambda functions: cached client and event parsing.
 *
 * <p>Use {@link #parseEvent(SQSEvent)} in functions fed by a queue that is subscribed to an SNS
 * topic with raw message delivery. Bodies that are JSON are decoded to plain Java values ({@link
 * Map}, {@link List}, {@link String}, {@link Number}, {@link Boolean} or {@code null}); any other
 * body is returned as the original string.
 *
 * <p>Configuration: LOCALSTACK_SQS_URL overrides the endpoint.
 */
public class SqsHelper {

  private final ClientCache cache;
  private final ObjectMapper mapper;

  public SqsHelper(final ClientCache cache, final ObjectMapper mapper) {
    this.cache = cache;
    this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /** Returns the cached SQS client, creating it on first use. */
  public SqsClient client() {
    return cache.getClient(AwsService.SQS);
  }

  /**
   * Lazily decodes the bodies of the records of an event, in record order.
   *
   * @param event event passed to the handler
   * @return one decoded body per record, nothing when the event carries no records
   */
  public Stream<Object> parseEvent(final SQSEvent event) {
    if (event.getRecords() == null) return Stream.empty();
    return event.getRecords().stream().map(SQSEvent.SQSMessage::getBody).map(this::parseBody);
  }

  /**
   * Lazily decodes the bodies of an event received as a raw map, as handlers declared with {@code
   * RequestHandler<Map<String, Object>, ?>} get it.
   *
   * @param event event with a {@code Records} list of records holding a {@code body}
   * @return one decoded body per record
   * @throws IllegalArgumentException if the event has no {@code Records} list
   */
  public Stream<Object> parseEvent(final Map<String, ?> event) {
    if (!(event.get("Records") instanceof List<?> records))
      throw new IllegalArgumentException("Not a SQS event: missing \"Records\"");
    return records.stream().map(SqsHelper::body).map(this::parseBody);
  }

  /**
   * Decodes one message body. Never fails on malformed input.
   *
   * @param body message body
   * @return the decoded JSON value, or {@code body} itself when it is not a single JSON value
   */
  public Object parseBody(final String body) {
    if (body == null) return null;
    try {
      return mapper.readValue(body, Object.class);
    } catch (final JsonProcessingException e) {
      return body;
    }
  }

  private static String body(final Object record) {
    if (!(record instanceof Map<?, ?> fields))
      throw new IllegalArgumentException("Not a SQS record: " + record);
    final var body = fields.get("body");
    return body == null ? null : body.toString();
  }
}
