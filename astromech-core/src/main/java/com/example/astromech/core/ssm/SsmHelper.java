package com.example.astromech.core.ssm;

import com.example.astromech.core.client.AwsService;
import com.example.astromech.core.client.ClientCache;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

/**
 * Systems Manager access for Lambda functions: cached client and Parameter Store reads.
 *
 * <p>Configuration: LOCALSTACK_SSM_URL overrides the endpoint.
 */
public class SsmHelper {

  private final ClientCache cache;

  public SsmHelper(final ClientCache cache) {
    this.cache = cache;
  }

  /** Returns the cached SSM client, creating it on first use. */
  public SsmClient client() {
    return cache.getClient(AwsService.SSM);
  }

  /**
   * Returns the value of a parameter from Parameter Store.
   *
   * <p>SDK exceptions propagate, e.g. {@code ParameterNotFoundException} for a missing parameter.
   *
   * @param name parameter name
   * @param decrypt whether to decrypt a {@code SecureString} parameter
   * @return the parameter value
   */
  public String getParamValue(final String name, final boolean decrypt) {
    final var request = GetParameterRequest.builder().name(name).withDecryption(decrypt).build();
    return client().getParameter(request).parameter().value();
  }
}
