/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import lombok.NonNull;

/**
 * In-process cache guarded by a single lock.
 *
 * <p>Expiry is passive: an entry is checked against the clock on read and evicted there. There is
 * no background sweep, so entries that are never read again stay until overwritten.
 */
public final class InMemoryQueryCache implements QueryCache {

  private record Entry(String value, Instant expiresAt) {}

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Entry> entries = new HashMap<>();
  private final Clock clock;

  public InMemoryQueryCache() {
    this(Clock.systemUTC());
  }

  public InMemoryQueryCache(@NonNull final Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(@NonNull final String key) {
    lock.lock();
    try {
      final var entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (!clock.instant().isBefore(entry.expiresAt())) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(
      @NonNull final String key, @NonNull final String value, @NonNull final Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
    }
    lock.lock();
    try {
      entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    } finally {
      lock.unlock();
    }
  }

  /** Stored entries, expired ones included until their next read. */
  int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String getName() {
    return "in-memory";
  }
}
