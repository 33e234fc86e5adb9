package com.example.astromech.core.client;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.astromech.core.config.Environment;
import java.lang.System.Logger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import software.amazon.awssdk.core.SdkClient;

/**
 * Holds one lazily created handle per slot: the client of each {@link AwsService}, plus any derived
 * handle a helper registers under its own slot (the DynamoDB table, the enhanced client).
 *
 * <p>Create one cache per Lambda container, typically in a static field of the handler class, so
 * that clients are reused across invocations:
 *
 * <pre>{@code
 * private static final ClientCache CLIENTS = ClientCache.builder().build();
 *
 * public Void handleRequest(final SQSEvent event, final Context context) {
 *   final var s3 = CLIENTS.getClient(AwsService.S3);
 *   ...
 * }
 * }</pre>
 *
 * <p>The first request for a slot resolves the endpoint override and builds the handle. Every later
 * request returns the stored handle, even when the environment changed in between; call {@link
 * #reset(String)} or {@link #resetAll()} to force re-resolution. Slot creation is synchronized, so
 * concurrent first calls still produce a single handle.
 */
public final class ClientCache implements AutoCloseable {

  private static final Logger logger = System.getLogger(ClientCache.class.getName());

  private final EndpointResolver endpointResolver;
  private final Map<AwsService<?>, ClientFactory<?>> factories;
  private final Map<String, Object> handles = new HashMap<>();
  private final Map<String, Set<String>> dependents = new HashMap<>();

  private ClientCache(final Builder builder) {
    this.endpointResolver = new EndpointResolver(builder.environment);
    this.factories = Map.copyOf(builder.factories);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the cached client of a service, building it on first use.
   *
   * @param service the service
   * @param <T> client type
   * @return the cached client
   */
  public <T extends SdkClient> T getClient(final AwsService<T> service) {
    return getHandle(service.slot(), service.clientType(), () -> createClient(service));
  }

  /**
   * Returns the handle stored under {@code slot}, creating it with {@code constructor} when the
   * slot is empty. Nothing is stored when the constructor throws.
   *
   * @param slot cache slot
   * @param type expected handle type
   * @param constructor creates the handle on first use
   * @param <T> handle type
   * @return the cached handle
   */
  public synchronized <T> T getHandle(
      final String slot, final Class<T> type, final Supplier<? extends T> constructor) {
    return Optional.ofNullable(handles.get(slot))
        .map(type::cast)
        .orElseGet(
            () -> {
              final T handle =
                  Objects.requireNonNull(constructor.get(), "constructor returned null: " + slot);
              handles.put(slot, handle);
              return handle;
            });
  }

  /**
   * Returns the handle stored under {@code slot}, creating it on first use from a handle held in
   * {@code dependsOn}. Resetting {@code dependsOn} also resets {@code slot}, so the derived handle
   * never outlives the one it was built from.
   *
   * @param slot cache slot
   * @param dependsOn slot of the handle the constructor builds on
   * @param type expected handle type
   * @param constructor creates the handle on first use
   * @param <T> handle type
   * @return the cached handle
   */
  public synchronized <T> T getHandle(
      final String slot,
      final String dependsOn,
      final Class<T> type,
      final Supplier<? extends T> constructor) {
    dependents.computeIfAbsent(dependsOn, parent -> new LinkedHashSet<>()).add(slot);
    return getHandle(slot, type, constructor);
  }

  /**
   * Tells whether a slot currently holds a handle.
   *
   * @param slot cache slot
   * @return {@code true} if a handle is cached
   */
  public synchronized boolean isCached(final String slot) {
    return handles.containsKey(slot);
  }

  /**
   * Empties a slot, closing the handle if it is closeable, then empties the slots built on it. The
   * next request rebuilds them with the environment as it is then.
   *
   * @param slot cache slot
   */
  public synchronized void reset(final String slot) {
    Optional.ofNullable(dependents.remove(slot)).ifPresent(slots -> slots.forEach(this::reset));
    Optional.ofNullable(handles.remove(slot)).ifPresent(handle -> closeHandle(slot, handle));
  }

  /** Empties every slot, closing closeable handles. */
  public synchronized void resetAll() {
    new ArrayList<>(handles.keySet()).forEach(this::reset);
  }

  @Override
  public void close() {
    resetAll();
  }

  @SuppressWarnings("unchecked")
  private <T extends SdkClient> T createClient(final AwsService<T> service) {
    final var endpoint = endpointResolver.resolve(service);
    final var factory =
        (ClientFactory<? extends T>) factories.getOrDefault(service, service.defaultFactory());
    endpoint.ifPresentOrElse(
        uri -> logger.log(DEBUG, "Creating {0} client with endpoint {1}", service, uri),
        () -> logger.log(DEBUG, "Creating {0} client with the default endpoint", service));
    return service.clientType().cast(factory.create(endpoint));
  }

  private static void closeHandle(final String slot, final Object handle) {
    if (handle instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close cached handle " + slot, e);
      }
    }
  }

  /** Builder for {@link ClientCache}. */
  public static class Builder {
    private Environment environment = Environment.system();
    private final Map<AwsService<?>, ClientFactory<?>> factories = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Sets where endpoint overrides are read from.
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
     * Replaces the way one service's client is built, e.g. to attach a custom HTTP client or to
     * hand out a test double.
     *
     * @param service the service
     * @param factory builds the client from the resolved endpoint override
     * @param <T> client type
     * @return this builder
     */
    public <T extends SdkClient> Builder clientFactory(
        final AwsService<T> service, final ClientFactory<? extends T> factory) {
      this.factories.put(
          Objects.requireNonNull(service, "service"), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    /**
     * Builds the cache. No client is created until first requested.
     *
     * @return empty cache
     * @throws IllegalStateException if no environment is set
     */
    public ClientCache build() {
      if (environment == null) throw new IllegalStateException("environment is required");
      return new ClientCache(this);
    }
  }
}
