package com.example.astromech.core.client;

import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Reads the endpoint override of a service from the {@link Environment}.
 *
 * <p>When no override is configured the result is empty and the SDK resolves the public endpoint
 * itself; no URL is synthesized here.
 */
public final class EndpointResolver {

  private final Environment environment;

  public EndpointResolver(final Environment environment) {
    this.environment = environment;
  }

  /**
   * Resolves the endpoint override for a service.
   *
   * @param service the service
   * @return the override, or empty to use the SDK default
   * @throws ConfigurationException if the configured value is not a valid URI
   */
  public Optional<URI> resolve(final AwsService<?> service) {
    return environment
        .get(service.endpointVariable())
        .map(value -> toUri(service.endpointVariable(), value));
  }

  private static URI toUri(final String variable, final String value) {
    try {
      return new URI(value.trim());
    } catch (final URISyntaxException e) {
      throw new ConfigurationException(
          "Invalid endpoint URL in \"%s\": %s".formatted(variable, value), e);
    }
  }
}
