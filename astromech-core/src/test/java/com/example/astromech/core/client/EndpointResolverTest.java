package com.example.astromech.core.client;

import static org.junit.jupiter.api.Assertions.*;

import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EndpointResolverTest {

  @Test
  void resolvesOverrideOfEachService() {
    final var resolver =
        new EndpointResolver(
            Environment.of(
                Map.of(
                    "LOCALSTACK_DYNAMODB_URL", "http://localhost:4566",
                    "LOCALSTACK_SSM_URL", "http://ssm.local:4583")));

    assertEquals(
        Optional.of(URI.create("http://localhost:4566")), resolver.resolve(AwsService.DYNAMODB));
    assertEquals(Optional.of(URI.create("http://ssm.local:4583")), resolver.resolve(AwsService.SSM));
    assertTrue(resolver.resolve(AwsService.S3).isEmpty());
  }

  @Test
  void rejectsMalformedUrl() {
    final var resolver =
        new EndpointResolver(Environment.of(Map.of("LOCALSTACK_SNS_URL", "http://bad host")));

    final var error =
        assertThrows(ConfigurationException.class, () -> resolver.resolve(AwsService.SNS));
    assertTrue(error.getMessage().contains("LOCALSTACK_SNS_URL"));
  }

  @Test
  void eachServiceHasItsOwnVariable() {
    assertEquals("LOCALSTACK_DYNAMODB_URL", AwsService.DYNAMODB.endpointVariable());
    assertEquals("LOCALSTACK_S3_URL", AwsService.S3.endpointVariable());
    assertEquals("LOCALSTACK_SNS_URL", AwsService.SNS.endpointVariable());
    assertEquals("LOCALSTACK_SQS_URL", AwsService.SQS.endpointVariable());
    assertEquals("LOCALSTACK_SSM_URL", AwsService.SSM.endpointVariable());
  }
}
