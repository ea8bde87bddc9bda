/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics;

import java.time.Duration;

import com.macstab.oss.querygateway.model.ResultSource;

/**
 * Framework-agnostic metrics interface for the query gateway.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only the methods they need, core library calls all methods safely (no null checks).
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - Zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerQueryGatewayMetrics} - Micrometer integration (Spring Boot Actuator)
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Dispatcher workers,
 * client handlers and the maintenance handler call recording methods concurrently.
 *
 * <p><strong>Lock discipline:</strong> Recording methods are invoked with no gateway lock held
 * except {@link #setQueueDepth(int)} and {@link #recordTaskSelected(int, Duration)}, which the
 * task queue calls under its own lock. Implementations MUST NOT block or call back into the
 * gateway.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface QueryGatewayMetrics extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  QueryGatewayMetrics NOOP = new QueryGatewayMetrics() {};

  /**
   * Records a task entering the queue.
   *
   * <p><strong>Metric Type:</strong> Counter, tagged by priority.
   *
   * @param priority task priority (1-9)
   */
  default void recordTaskEnqueued(int priority) {
    // No-op by default
  }

  /**
   * Records a task chosen by the scheduler.
   *
   * <p><strong>Metric Type:</strong> Timer (queue wait), tagged by priority.
   *
   * @param priority task priority (1-9)
   * @param waited time the task spent queued
   */
  default void recordTaskSelected(int priority, Duration waited) {
    // No-op by default
  }

  /**
   * Reports current queue depth.
   *
   * <p><strong>Metric Type:</strong> Gauge
   *
   * @param depth pending task count
   */
  default void setQueueDepth(int depth) {
    // No-op by default
  }

  /**
   * Reports how many pooled connections are currently borrowed.
   *
   * <p><strong>Metric Type:</strong> Gauge, tagged by pool name.
   *
   * @param poolName pool name (dimensional tag)
   * @param inUse borrowed connection count
   */
  default void setConnectionsInUse(String poolName, int inUse) {
    // No-op by default
  }

  /**
   * Records replacement of an invalid pooled session.
   *
   * @param poolName pool name (dimensional tag)
   * @param slot slot index of the replaced connection
   */
  default void recordConnectionReplaced(String poolName, int slot) {
    // No-op by default
  }

  default void recordCacheHit() {
    // No-op by default
  }

  default void recordCacheMiss() {
    // No-op by default
  }

  /**
   * Records a cache backend failure (read or write), absorbed by the cache-aside layer.
   *
   * @param operation {@code get} or {@code put}
   */
  default void recordCacheError(String operation) {
    // No-op by default
  }

  /**
   * Records one completed query.
   *
   * <p><strong>Metric Type:</strong> Timer (latency) + counter (rows), tagged by source.
   *
   * @param source {@code db} or {@code cache}
   * @param latency execution latency
   * @param rows returned row count
   */
  default void recordQueryCompleted(ResultSource source, Duration latency, long rows) {
    // No-op by default
  }

  default void recordQueryFailed() {
    // No-op by default
  }

  /**
   * Releases registered meters. Idempotent.
   *
   * <p><strong>Exception Safety:</strong> MUST NOT throw (called from shutdown paths).
   */
  @Override
  default void close() {
    // No-op by default
  }
}
