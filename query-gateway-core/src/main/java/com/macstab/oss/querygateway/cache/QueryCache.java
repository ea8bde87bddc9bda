/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store for serialized query results with per-entry time-to-live.
 *
 * <p>An entry is visible only while {@code now < insertedAt + ttl}. Implementations MUST be
 * thread-safe; backend failures surface as {@link CacheAccessException}.
 */
public interface QueryCache extends AutoCloseable {

  /**
   * Looks up a live entry.
   *
   * @param key fingerprint
   * @return stored payload, or empty on miss or expiry
   * @throws CacheAccessException if the backend cannot be reached
   */
  Optional<String> get(String key);

  /**
   * Stores a payload, replacing any previous entry.
   *
   * @param key fingerprint
   * @param value serialized payload
   * @param ttl time-to-live (must be positive)
   * @throws CacheAccessException if the backend cannot be reached
   */
  void put(String key, String value, Duration ttl);

  /** Backend name for logs, e.g. "redis" or "in-memory". */
  String getName();

  @Override
  default void close() {
    // Nothing to release by default
  }
}
