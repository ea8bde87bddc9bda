/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Networked cache with a permanent in-process fallback.
 *
 * <p><strong>Switch-over:</strong> The first {@link CacheAccessException} from the primary flips
 * the cache into fallback mode for the rest of the process lifetime. The failing read counts as a
 * miss; the failing write is dropped. Entries already in Redis are not migrated.
 *
 * <p>This class never throws {@link CacheAccessException}: a cache fault can cost a re-execution
 * but never a query result.
 */
@Slf4j
public final class FallbackQueryCache implements QueryCache {

  private final QueryCache primary;
  private final QueryCache fallback;
  private final QueryGatewayMetrics metrics;
  private final AtomicBoolean degraded;

  public FallbackQueryCache(
      @NonNull final QueryCache primary,
      @NonNull final QueryCache fallback,
      @NonNull final QueryGatewayMetrics metrics) {
    this.primary = primary;
    this.fallback = fallback;
    this.metrics = metrics;
    this.degraded = new AtomicBoolean(false);
  }

  @Override
  public Optional<String> get(final String key) {
    if (degraded.get()) {
      return fallback.get(key);
    }
    try {
      return primary.get(key);
    } catch (final CacheAccessException e) {
      metrics.recordCacheError("get");
      degrade(e);
      return Optional.empty();
    }
  }

  @Override
  public void put(final String key, final String value, final Duration ttl) {
    if (degraded.get()) {
      fallback.put(key, value, ttl);
      return;
    }
    try {
      primary.put(key, value, ttl);
    } catch (final CacheAccessException e) {
      metrics.recordCacheError("put");
      degrade(e);
    }
  }

  public boolean isDegraded() {
    return degraded.get();
  }

  @Override
  public String getName() {
    return degraded.get() ? fallback.getName() : primary.getName();
  }

  @Override
  public void close() {
    try {
      primary.close();
    } catch (final RuntimeException e) {
      log.warn("Error closing {} cache", primary.getName(), e);
    }
    fallback.close();
  }

  private void degrade(final CacheAccessException cause) {
    if (degraded.compareAndSet(false, true)) {
      log.warn(
          "{} cache failed, switching to {} cache: {}",
          primary.getName(), fallback.getName(), cause.getMessage());
    }
  }
}
