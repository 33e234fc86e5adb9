package com.example.astromech.core.client;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.core.SdkClient;

/**
 * Functional factory that builds an AWS SDK client. Implementations apply the endpoint override
 * when one is given and otherwise leave endpoint resolution to the SDK.
 *
 * @param <T> client type
 */
@FunctionalInterface
public interface ClientFactory<T extends SdkClient> {
  /**
   * Creates a new client.
   *
   * @param endpointOverride endpoint to use instead of the public AWS endpoint, if any
   * @return a new client
   */
  T create(final Optional<URI> endpointOverride);
}
