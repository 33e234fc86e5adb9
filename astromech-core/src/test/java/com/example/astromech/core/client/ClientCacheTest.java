package com.example.astromech.core.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.astromech.core.config.Environment;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sqs.SqsClient;

class ClientCacheTest {

  private Map<String, String> variables;
  private ClientCache cache;

  @BeforeEach
  void setup() {
    System.setProperty("aws.region", "us-east-1");
    variables = new HashMap<>();
    cache = ClientCache.builder().environment(Environment.of(variables)).build();
  }

  @AfterEach
  void tearDown() {
    cache.close();
    System.clearProperty("aws.region");
  }

  @Nested
  @DisplayName("Endpoint resolution")
  class EndpointResolution {

    @Test
    @DisplayName("first call applies the endpoint override from the environment")
    void firstCallAppliesOverride() {
      variables.put("LOCALSTACK_S3_URL", "http://localhost:4566");

      final var client = cache.getClient(AwsService.S3);

      assertEquals(
          Optional.of(URI.create("http://localhost:4566")),
          client.serviceClientConfiguration().endpointOverride());
    }

    @Test
    @DisplayName("without an override the SDK default endpoint is used")
    void noOverrideLeavesDefault() {
      final var client = cache.getClient(AwsService.SQS);

      assertTrue(client.serviceClientConfiguration().endpointOverride().isEmpty());
    }

    @Test
    @DisplayName("second call ignores environment changes and returns the same client")
    void secondCallDoesNotReResolve() {
      variables.put("LOCALSTACK_SNS_URL", "http://localhost:4566");
      final var first = cache.getClient(AwsService.SNS);

      variables.put("LOCALSTACK_SNS_URL", "http://elsewhere:9999");
      final var second = cache.getClient(AwsService.SNS);

      assertSame(first, second);
      assertEquals(
          Optional.of(URI.create("http://localhost:4566")),
          second.serviceClientConfiguration().endpointOverride());
    }

    @Test
    @DisplayName("reset forces re-resolution with the current environment")
    void resetForcesReResolution() {
      variables.put("LOCALSTACK_SQS_URL", "http://localhost:4566");
      final var first = cache.getClient(AwsService.SQS);

      variables.put("LOCALSTACK_SQS_URL", "http://localhost:4577");
      cache.reset(AwsService.SQS.slot());
      final var second = cache.getClient(AwsService.SQS);

      assertNotSame(first, second);
      assertEquals(
          Optional.of(URI.create("http://localhost:4577")),
          second.serviceClientConfiguration().endpointOverride());
    }
  }

  @Nested
  @DisplayName("Client factories")
  class ClientFactories {

    @Test
    void customFactoryReceivesResolvedEndpoint() {
      variables.put("LOCALSTACK_SQS_URL", "http://localhost:4566");
      final var seen = new ArrayList<Optional<URI>>();
      final var mockClient = mock(SqsClient.class);
      final var custom =
          ClientCache.builder()
              .environment(Environment.of(variables))
              .clientFactory(
                  AwsService.SQS,
                  endpoint -> {
                    seen.add(endpoint);
                    return mockClient;
                  })
              .build();

      assertSame(mockClient, custom.getClient(AwsService.SQS));
      assertSame(mockClient, custom.getClient(AwsService.SQS));
      assertEquals(1, seen.size());
      assertEquals(Optional.of(URI.create("http://localhost:4566")), seen.get(0));
    }

    @Test
    void factoryFailureLeavesSlotEmpty() {
      final var attempts = new AtomicInteger();
      final var failing =
          ClientCache.builder()
              .environment(Environment.of(variables))
              .clientFactory(
                  AwsService.SNS,
                  endpoint -> {
                    if (attempts.incrementAndGet() == 1) throw new IllegalStateException("boom");
                    return mock(SnsClient.class);
                  })
              .build();

      assertThrows(IllegalStateException.class, () -> failing.getClient(AwsService.SNS));
      assertFalse(failing.isCached(AwsService.SNS.slot()));

      assertNotNull(failing.getClient(AwsService.SNS));
      assertTrue(failing.isCached(AwsService.SNS.slot()));
    }
  }

  @Nested
  @DisplayName("Handles")
  class Handles {

    @Test
    void getHandleCreatesOnce() {
      final var created = new AtomicInteger();

      final var first = cache.getHandle("custom", String.class, () -> "h" + created.incrementAndGet());
      final var second =
          cache.getHandle("custom", String.class, () -> "h" + created.incrementAndGet());

      assertEquals("h1", first);
      assertEquals("h1", second);
      assertEquals(1, created.get());
    }

    @Test
    void getHandleRejectsNullHandle() {
      assertThrows(NullPointerException.class, () -> cache.getHandle("nothing", String.class, () -> null));
      assertFalse(cache.isCached("nothing"));
    }

    @Test
    @DisplayName("resetting a slot also resets the handles built on it")
    void resetCascadesToDependents() {
      cache.getHandle("base", String.class, () -> "base");
      cache.getHandle("derived", "base", String.class, () -> "derived");
      cache.getHandle("derived-twice", "derived", String.class, () -> "derived-twice");
      cache.getHandle("other", String.class, () -> "other");

      cache.reset("base");

      assertFalse(cache.isCached("base"));
      assertFalse(cache.isCached("derived"));
      assertFalse(cache.isCached("derived-twice"));
      assertTrue(cache.isCached("other"));
    }

    @Test
    void resettingDependentKeepsBase() {
      cache.getHandle("base", String.class, () -> "base");
      cache.getHandle("derived", "base", String.class, () -> "derived");

      cache.reset("derived");

      assertTrue(cache.isCached("base"));
      assertFalse(cache.isCached("derived"));
    }

    @Test
    @DisplayName("reset and close close the cached clients")
    void resetClosesClients() {
      final var s3 = mock(S3Client.class);
      final var sqs = mock(SqsClient.class);
      final var mocked =
          ClientCache.builder()
              .environment(Environment.of(variables))
              .clientFactory(AwsService.S3, endpoint -> s3)
              .clientFactory(AwsService.SQS, endpoint -> sqs)
              .build();
      mocked.getClient(AwsService.S3);
      mocked.getClient(AwsService.SQS);

      mocked.reset(AwsService.S3.slot());
      verify(s3, times(1)).close();
      verify(sqs, never()).close();
      assertFalse(mocked.isCached(AwsService.S3.slot()));

      mocked.close();
      verify(sqs, times(1)).close();
      assertFalse(mocked.isCached(AwsService.SQS.slot()));
    }

    @Test
    @DisplayName("a failing close does not abort the reset")
    void failingCloseIsTolerated() {
      final var s3 = mock(S3Client.class);
      doThrow(new IllegalStateException("already closed")).when(s3).close();
      final var mocked =
          ClientCache.builder()
              .environment(Environment.of(variables))
              .clientFactory(AwsService.S3, endpoint -> s3)
              .build();
      mocked.getClient(AwsService.S3);

      assertDoesNotThrow(mocked::resetAll);
      assertFalse(mocked.isCached(AwsService.S3.slot()));
    }

    @Test
    @DisplayName("concurrent first calls create a single handle")
    void concurrentFirstCallsCreateOneHandle() throws Exception {
      final var created = new AtomicInteger();
      final var start = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(8);
      try {
        final var futures = new ArrayList<Future<Object>>();
        for (var i = 0; i < 8; i++) {
          futures.add(
              executor.submit(
                  () -> {
                    start.await();
                    return cache.getHandle(
                        "shared",
                        Object.class,
                        () -> {
                          created.incrementAndGet();
                          return new Object();
                        });
                  }));
        }
        start.countDown();

        final var first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (final var future : futures) {
          assertSame(first, future.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, created.get());
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Test
  void builderRequiresEnvironment() {
    assertThrows(
        IllegalStateException.class, () -> ClientCache.builder().environment(null).build());
  }
}
