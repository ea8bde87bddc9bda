/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.micrometer;

import static com.macstab.oss.querygateway.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.model.ResultSource;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link QueryGatewayMetrics}.
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code querygate.tasks.enqueued}</td><td>Counter</td><td>priority</td></tr>
 *     <tr><td>{@code querygate.tasks.wait}</td><td>Timer</td><td>priority</td></tr>
 *     <tr><td>{@code querygate.queue.depth}</td><td>Gauge</td><td>-</td></tr>
 *     <tr><td>{@code querygate.pool.in_use}</td><td>Gauge</td><td>pool.name</td></tr>
 *     <tr><td>{@code querygate.pool.replacements}</td><td>Counter</td><td>pool.name</td></tr>
 *     <tr><td>{@code querygate.cache.requests}</td><td>Counter</td><td>result (hit|miss)</td></tr>
 *     <tr><td>{@code querygate.cache.errors}</td><td>Counter</td><td>operation (get|put)</td></tr>
 *     <tr><td>{@code querygate.query.latency}</td><td>Timer</td><td>source (db|cache)</td></tr>
 *     <tr><td>{@code querygate.query.rows}</td><td>Counter</td><td>source (db|cache)</td></tr>
 *     <tr><td>{@code querygate.query.failures}</td><td>Counter</td><td>-</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Thread Safety:</strong> All methods are safe for concurrent use; meter instances come
 * from a {@link MetricCache}. After {@link #close()} every recording call is a no-op.
 */
@Slf4j
public final class MicrometerQueryGatewayMetrics implements QueryGatewayMetrics {

  private final MetricCache cache;

  // Closed flag (idempotent close)
  private volatile boolean closed = false;

  /**
   * Creates Micrometer metrics.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meter instances
   */
  public MicrometerQueryGatewayMetrics(
      @NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);
    log.debug("Created MicrometerQueryGatewayMetrics (maxCacheSize: {})", maxCacheSize);
  }

  public MicrometerQueryGatewayMetrics(@NonNull final MeterRegistry registry) {
    this(registry, 1000);
  }

  @Override
  public void recordTaskEnqueued(final int priority) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            TASKS_ENQUEUED, "Tasks accepted into the queue", TAG_PRIORITY, String.valueOf(priority))
        .increment();
  }

  @Override
  public void recordTaskSelected(final int priority, final Duration waited) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateTimer(
            TASK_WAIT,
            "Time tasks spent queued before selection",
            TAG_PRIORITY,
            String.valueOf(priority))
        .record(waited.isNegative() ? Duration.ZERO : waited);
  }

  @Override
  public void setQueueDepth(final int depth) {
    if (closed) {
      return;
    }
    cache.getOrCreateGaugeValue(QUEUE_DEPTH, "Pending tasks").set(depth);
  }

  @Override
  public void setConnectionsInUse(final String poolName, final int inUse) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateGaugeValue(
            POOL_IN_USE, "Borrowed pooled connections", TAG_POOL_NAME, poolName)
        .set(inUse);
  }

  @Override
  public void recordConnectionReplaced(final String poolName, final int slot) {
    if (closed) {
      return;
    }
    if (slot < 0) {
      log.warn("Invalid slot index: {} (negative), skipping metric", slot);
      return;
    }
    cache
        .getOrCreateCounter(
            POOL_REPLACEMENTS, "Invalid sessions replaced in place", TAG_POOL_NAME, poolName)
        .increment();
  }

  @Override
  public void recordCacheHit() {
    recordCacheRequest(RESULT_HIT);
  }

  @Override
  public void recordCacheMiss() {
    recordCacheRequest(RESULT_MISS);
  }

  @Override
  public void recordCacheError(final String operation) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(
            CACHE_ERRORS, "Cache backend failures absorbed", TAG_OPERATION, operation)
        .increment();
  }

  @Override
  public void recordQueryCompleted(
      final ResultSource source, final Duration latency, final long rows) {
    if (closed) {
      return;
    }
    final var sourceTag = source.wireName();
    cache
        .getOrCreateTimer(QUERY_LATENCY, "Query latency", TAG_SOURCE, sourceTag)
        .record(latency);
    cache
        .getOrCreateCounter(QUERY_ROWS, "Rows returned to clients", TAG_SOURCE, sourceTag)
        .increment(rows);
  }

  @Override
  public void recordQueryFailed() {
    if (closed) {
      return;
    }
    cache.getOrCreateCounter(QUERY_FAILURES, "Tasks answered with an error").increment();
  }

  @Override
  public void close() {
    if (closed) {
      return; // Idempotent
    }
    closed = true;
    try {
      cache.clear();
      log.info("Closed MicrometerQueryGatewayMetrics");
    } catch (final Exception e) {
      // MUST NOT throw (called from shutdown)
      log.error("Error during metrics cleanup", e);
    }
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }

  private void recordCacheRequest(final String result) {
    if (closed) {
      return;
    }
    cache
        .getOrCreateCounter(CACHE_REQUESTS, "Cache lookups by result", TAG_RESULT, result)
        .increment();
  }
}
