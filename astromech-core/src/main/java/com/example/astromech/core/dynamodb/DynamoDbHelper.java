package com.example.astromech.core.dynamodb;

import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import java.util.Map;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * DynamoDB access for Lambda functions: cached client, enhanced client and table handles.
 *
 * <p>Configuration:
 *
 * <ul>
 *   <li>DYNAMODB_TABLE: table used when {@link #table(String)} gets no name
 *   <li>LOCALSTACK_DYNAMODB_URL: endpoint override
 * </ul>
 */
public class DynamoDbHelper {

  public static final String TABLE_VARIABLE = "DYNAMODB_TABLE";
  public static final String TABLE_SLOT = "dynamodb.table";
  public static final String ENHANCED_CLIENT_SLOT = "dynamodb.enhanced";

  private final ClientCache cache;
  private final Environment environment;

  public DynamoDbHelper(final ClientCache cache, final Environment environment) {
    this.cache = cache;
    this.environment = environment;
  }

  /** Returns the cached DynamoDB client, creating it on first use. */
  public DynamoDbClient client() {
    return cache.getClient(AwsService.DYNAMODB);
  }

  /** Returns the cached enhanced client, built on top of {@link #client()}. */
  public DynamoDbEnhancedClient enhancedClient() {
    return cache.getHandle(
        ENHANCED_CLIENT_SLOT,
        AwsService.DYNAMODB.slot(),
        DynamoDbEnhancedClient.class,
        () -> DynamoDbEnhancedClient.builder().dynamoDbClient(client()).build());
  }

  /**
   * Returns the cached table, resolving its name from {@code DYNAMODB_TABLE}.
   *
   * @return the table
   * @throws ConfigurationException if the table is not cached yet and the variable is unset
   */
  public Table table() {
    return table(null);
  }

  /**
   * Returns the cached table.
   *
   * <p>On first use the name is taken from {@code tableName}, falling back to {@code
   * DYNAMODB_TABLE}. Once cached, the same table is returned whatever name is passed; reset the
   * {@link #TABLE_SLOT} slot to switch tables. Resetting the client slot resets the table too.
   *
   * @param tableName table name, or {@code null} to use the environment
   * @return the table
   * @throws ConfigurationException if no table name can be resolved on first use
   */
  public Table table(final String tableName) {
    return cache.getHandle(
        TABLE_SLOT,
        AwsService.DYNAMODB.slot(),
        Table.class,
        () -> {
          final var name =
              environment
                  .resolve(tableName, TABLE_VARIABLE)
                  .orElseThrow(() -> ConfigurationException.missing(TABLE_VARIABLE));
          return new Table(client(), name);
        });
  }

  /**
   * Checks whether an item exists in the cached table.
   *
   * @param key attribute name to string value of the primary key
   * @return {@code true} if an item with that key exists
   */
  public boolean exists(final Map<String, String> key) {
    return table().exists(key);
  }
}
