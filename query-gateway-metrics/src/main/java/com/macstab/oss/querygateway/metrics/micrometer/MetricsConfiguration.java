/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Meter names and tag keys published by {@link MicrometerQueryGatewayMetrics}.
 *
 * <p>Names follow Micrometer's dot convention; registries translate them (e.g. Prometheus turns
 * {@code querygate.queue.depth} into {@code querygate_queue_depth}).
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix. */
  public static final String PREFIX = "querygate";

  public static final String TASKS_ENQUEUED = PREFIX + ".tasks.enqueued";

  /** Queue wait of selected tasks. */
  public static final String TASK_WAIT = PREFIX + ".tasks.wait";

  public static final String QUEUE_DEPTH = PREFIX + ".queue.depth";

  public static final String POOL_IN_USE = PREFIX + ".pool.in_use";

  public static final String POOL_REPLACEMENTS = PREFIX + ".pool.replacements";

  public static final String CACHE_REQUESTS = PREFIX + ".cache.requests";

  public static final String CACHE_ERRORS = PREFIX + ".cache.errors";

  /** Latency of completed queries (stored latency for cache hits). */
  public static final String QUERY_LATENCY = PREFIX + ".query.latency";

  public static final String QUERY_ROWS = PREFIX + ".query.rows";

  public static final String QUERY_FAILURES = PREFIX + ".query.failures";

  // Tag keys
  public static final String TAG_PRIORITY = "priority";
  public static final String TAG_POOL_NAME = "pool.name";
  public static final String TAG_RESULT = "result";
  public static final String TAG_OPERATION = "operation";
  public static final String TAG_SOURCE = "source";

  // Tag values
  public static final String RESULT_HIT = "hit";
  public static final String RESULT_MISS = "miss";
}
