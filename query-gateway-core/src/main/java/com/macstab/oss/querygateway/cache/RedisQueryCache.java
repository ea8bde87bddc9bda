/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.time.Duration;
import java.util.Optional;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis-backed cache over one shared Lettuce connection.
 *
 * <p>Lettuce connections are thread-safe, so all dispatcher workers share a single connection.
 * Expiry is enforced by Redis itself ({@code SETEX}).
 *
 * <p>{@code autoReconnect(true)} lets the connection heal after a Redis restart; {@code
 * REJECT_COMMANDS} makes calls fail immediately while disconnected instead of buffering them, so
 * the caller sees a {@link CacheAccessException} right away.
 */
@Slf4j
public final class RedisQueryCache implements QueryCache {

  private final RedisClient client;
  private final StatefulRedisConnection<String, String> connection;
  private final RedisCommands<String, String> commands;

  private RedisQueryCache(
      final RedisClient client, final StatefulRedisConnection<String, String> connection) {
    this.client = client;
    this.connection = connection;
    this.commands = connection.sync();
  }

  /**
   * Connects and verifies reachability with {@code PING}.
   *
   * @param uri Redis endpoint
   * @param timeout connect and command timeout
   * @return connected cache
   * @throws CacheAccessException if Redis is unreachable
   */
  public static RedisQueryCache connect(
      @NonNull final RedisURI uri, @NonNull final Duration timeout) {
    uri.setTimeout(timeout);
    final var client = RedisClient.create(uri);
    client.setOptions(
        ClientOptions.builder()
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build());
    try {
      final var connection = client.connect();
      connection.sync().ping();
      if (log.isInfoEnabled()) {
        log.info(
            "Connected query cache to redis://{}:{}/{}",
            uri.getHost(),
            uri.getPort(),
            uri.getDatabase());
      }
      return new RedisQueryCache(client, connection);
    } catch (final RuntimeException e) {
      client.shutdown();
      throw new CacheAccessException(
          "Redis unreachable at " + uri.getHost() + ":" + uri.getPort(), e);
    }
  }

  @Override
  public Optional<String> get(@NonNull final String key) {
    try {
      return Optional.ofNullable(commands.get(key));
    } catch (final RuntimeException e) {
      throw new CacheAccessException("GET " + key + " failed", e);
    }
  }

  @Override
  public void put(
      @NonNull final String key, @NonNull final String value, @NonNull final Duration ttl) {
    final long seconds = ttl.toSeconds();
    if (seconds < 1) {
      throw new IllegalArgumentException("ttl must be at least 1s for Redis, got: " + ttl);
    }
    try {
      commands.setex(key, seconds, value);
    } catch (final RuntimeException e) {
      throw new CacheAccessException("SETEX " + key + " failed", e);
    }
  }

  @Override
  public String getName() {
    return "redis";
  }

  @Override
  public void close() {
    try {
      connection.close();
    } finally {
      client.shutdown();
    }
  }
}
