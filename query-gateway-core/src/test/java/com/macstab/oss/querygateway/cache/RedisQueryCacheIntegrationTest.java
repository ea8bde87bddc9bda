/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;

/**
 * Integration tests with real Redis (Testcontainers).
 *
 * <p><strong>What We Test:</strong>
 *
 * <ul>
 *   <li>GET/SETEX round trip through Lettuce
 *   <li>Server-side TTL on stored entries
 *   <li>Connect failure surfaces as {@link CacheAccessException}
 *   <li>Fallback tier takes over once Redis stops answering
 * </ul>
 *
 * <p><strong>Requirements:</strong> Docker must be running.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Testcontainers
@DisplayName("RedisQueryCache Integration Tests (Real Redis)")
class RedisQueryCacheIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
          .withExposedPorts(6379)
          .withStartupTimeout(Duration.ofSeconds(30));

  private RedisURI uri;
  private RedisQueryCache cache;

  @BeforeEach
  void setUp() {
    uri = RedisURI.builder().withHost(REDIS.getHost()).withPort(REDIS.getFirstMappedPort()).build();
    cache = RedisQueryCache.connect(uri, Duration.ofSeconds(2));
  }

  @AfterEach
  void tearDown() {
    cache.close();
  }

  @Nested
  @DisplayName("Commands")
  class Commands {

    @Test
    @DisplayName("stores and reads back a value")
    void putGet_RoundTrip() {
      // Arrange
      final var key = QueryFingerprint.fingerprint("SELECT 1");

      // Act
      cache.put(key, "{\"rows\":1}", Duration.ofSeconds(60));

      // Assert
      assertThat(cache.get(key)).contains("{\"rows\":1}");
    }

    @Test
    @DisplayName("returns empty for an absent key")
    void get_Absent() {
      assertThat(cache.get("ch:query:absent")).isEmpty();
    }

    @Test
    @DisplayName("sets the ttl on the server")
    void put_SetsServerTtl() {
      // Arrange
      final var key = QueryFingerprint.fingerprint("SELECT ttl");

      // Act
      cache.put(key, "v", Duration.ofSeconds(300));

      // Assert
      final var client = RedisClient.create(uri);
      try (var connection = client.connect()) {
        assertThat(connection.sync().ttl(key)).isBetween(1L, 300L);
      } finally {
        client.shutdown();
      }
    }

    @Test
    @DisplayName("rejects a ttl below one second")
    void put_RejectsSubSecondTtl() {
      assertThatThrownBy(() -> cache.put("k", "v", Duration.ofMillis(500)))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("connect fails with CacheAccessException when nothing listens")
    void connect_Unreachable() {
      // Arrange
      final var dead = RedisURI.builder().withHost("127.0.0.1").withPort(1).build();

      // Act & Assert
      assertThatThrownBy(() -> RedisQueryCache.connect(dead, Duration.ofMillis(500)))
          .isInstanceOf(CacheAccessException.class)
          .hasMessageContaining("Redis unreachable");
    }

    @Test
    @DisplayName("fallback cache keeps serving after the Redis connection is gone")
    void fallback_AfterRedisClosed() {
      // Arrange
      final var own = RedisQueryCache.connect(uri, Duration.ofMillis(500));
      final var fallback =
          new FallbackQueryCache(own, new InMemoryQueryCache(), QueryGatewayMetrics.NOOP);
      own.close();

      // Act
      fallback.put("k", "v", Duration.ofSeconds(60));
      fallback.put("k", "v", Duration.ofSeconds(60));

      // Assert
      assertThat(fallback.isDegraded()).isTrue();
      assertThat(fallback.get("k")).contains("v");
    }
  }
}
