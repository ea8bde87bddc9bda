/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.micrometer;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of tagged meter instances.
 *
 * <p><strong>Problem:</strong> Registry lookup with tag matching runs on every recording call, and
 * dispatcher workers record on every task.
 *
 * <p><strong>Solution:</strong> Counters, timers and gauge holders are kept in {@code
 * ConcurrentHashMap}s keyed by {@code name:tag1=value1:tag2=value2}. The first access registers the
 * meter; later accesses are a map lookup.
 *
 * <p><strong>Bounded:</strong> At most {@code maxCacheSize} entries are cached. Beyond that, meters
 * are resolved through the registry directly (Micrometer deduplicates by id), with a warning. Tag
 * cardinality here is small and fixed (9 priorities, 2 sources, a few pool names), so the bound is
 * a safety net only.
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, Timer> timers;
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues;
  private final AtomicInteger cacheSize;

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(32);
    this.timers = new ConcurrentHashMap<>(32);
    this.gaugeValues = new ConcurrentHashMap<>(16);
    this.cacheSize = new AtomicInteger(0);
  }

  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);
    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }
    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Counter.builder(name).description(description).tags(tagPairs).register(registry);
          });
    }
    warnFull(key);
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);
    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);
    if (cached != null) {
      return cached;
    }
    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Timer.builder(name).description(description).tags(tagPairs).register(registry);
          });
    }
    warnFull(key);
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  /**
   * Gets or creates the value holder behind a gauge.
   *
   * <p>The gauge is registered on first access and reads the returned holder. A gauge created
   * after the cache is full is registered once by Micrometer; later holders for the same id are not
   * observed, so such a gauge keeps its first value.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return AtomicInteger holding the gauge value
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);
    final var key = buildKey(name, tagPairs);
    final var cached = gaugeValues.get(key);
    if (cached != null) {
      return cached;
    }
    if (cacheSize.get() < maxCacheSize) {
      return gaugeValues.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return registerGauge(name, description, tagPairs);
          });
    }
    warnFull(key);
    return registerGauge(name, description, tagPairs);
  }

  /** Removes every cached meter from the registry and empties the cache. */
  void clear() {
    counters.values().forEach(meter -> registry.remove(meter));
    timers.values().forEach(meter -> registry.remove(meter));
    gaugeValues.keySet().forEach(key -> removeGauge(key));
    counters.clear();
    timers.clear();
    gaugeValues.clear();
    cacheSize.set(0);
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  // ==================== Private Methods ====================

  private AtomicInteger registerGauge(
      final String name, final String description, final String... tagPairs) {
    final var gaugeValue = new AtomicInteger(0);
    Gauge.builder(name, gaugeValue, AtomicInteger::get)
        .description(description)
        .tags(tagPairs)
        .register(registry);
    return gaugeValue;
  }

  private void removeGauge(final String key) {
    final String[] parts = key.split(":");
    var search = registry.find(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      final int eq = parts[i].indexOf('=');
      search = search.tag(parts[i].substring(0, eq), parts[i].substring(eq + 1));
    }
    search.gauges().forEach(gauge -> registry.remove(gauge));
  }

  private void warnFull(final String key) {
    log.warn("Metric cache full at {} entries. Direct registry used for: {}", maxCacheSize, key);
  }

  /**
   * Builds cache key from metric name and tag pairs.
   *
   * <p><strong>Format:</strong> {@code metric.name:tag1=value1:tag2=value2}
   */
  private String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + (tagPairs.length / 2 * 20));
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
