package com.example.astromech.core.dynamodb;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * A DynamoDB table bound to a client. Obtained from {@link DynamoDbHelper#table(String)}, which
 * caches it for the life of the container.
 *
 * <p>All operations are passthroughs; SDK exceptions propagate unchanged.
 */
public final class Table {

  private final DynamoDbClient client;
  private final String tableName;

  Table(final DynamoDbClient client, final String tableName) {
    this.client = client;
    this.tableName = tableName;
  }

  public String tableName() {
    return tableName;
  }

  public DynamoDbClient client() {
    return client;
  }

  /**
   * Checks whether an item with the given string-typed primary key exists.
   *
   * @param key attribute name to string value
   * @return {@code true} if the table holds an item with that key
   */
  public boolean exists(final Map<String, String> key) {
    return existsItem(stringKey(key));
  }

  /**
   * Checks whether an item with the given primary key exists. Only the key attributes are
   * projected, so the response stays small.
   *
   * @param key the primary key
   * @return {@code true} if the response carries an item
   */
  public boolean existsItem(final Map<String, AttributeValue> key) {
    final var request =
        GetItemRequest.builder()
            .tableName(tableName)
            .key(key)
            .projectionExpression(String.join(",", key.keySet()))
            .build();
    return client.getItem(request).hasItem();
  }

  /**
   * Reads an item.
   *
   * @param key the primary key
   * @return the item, or empty if there is none
   */
  public Optional<Map<String, AttributeValue>> getItem(final Map<String, AttributeValue> key) {
    final var response =
        client.getItem(GetItemRequest.builder().tableName(tableName).key(key).build());
    return response.hasItem() ? Optional.of(response.item()) : Optional.empty();
  }

  /**
   * Writes an item, replacing any item with the same key.
   *
   * @param item the item attributes
   */
  public void putItem(final Map<String, AttributeValue> item) {
    client.putItem(PutItemRequest.builder().tableName(tableName).item(item).build());
  }

  /**
   * Deletes an item. Deleting a missing item is not an error.
   *
   * @param key the primary key
   */
  public void deleteItem(final Map<String, AttributeValue> key) {
    client.deleteItem(DeleteItemRequest.builder().tableName(tableName).key(key).build());
  }

  /**
   * Converts a key of string attributes to SDK attribute values, keeping the attribute order.
   *
   * @param key attribute name to string value
   * @return attribute name to {@code S} attribute value
   */
  public static Map<String, AttributeValue> stringKey(final Map<String, String> key) {
    final var converted = new LinkedHashMap<String, AttributeValue>();
    key.forEach((name, value) -> converted.put(name, AttributeValue.fromS(value)));
    return converted;
  }

  @Override
  public String toString() {
    return "Table[" + tableName + "]";
  }
}
