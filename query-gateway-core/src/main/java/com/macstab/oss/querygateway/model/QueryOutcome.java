/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.NonNull;

/**
 * Result of one completed task, tagged with its {@link ResultSource}.
 *
 * <p>Single result shape for both real executions and cache hits: the dispatcher replies with it,
 * the ledger records it, the cache stores it. Callers switch on {@link #source()} instead of
 * inspecting payload types.
 *
 * @param metrics three-phase resource-usage deltas
 * @param latencySeconds wall-clock latency of the execution in seconds
 * @param rows row count of the result
 * @param throughput {@code rows / latencySeconds}, 0 when latency is 0
 * @param source {@code db} for a real execution, {@code cache} for a hit
 */
public record QueryOutcome(
    @JsonProperty("metrics") @NonNull ResourceUsage metrics,
    @JsonProperty("latency_s") double latencySeconds,
    @JsonProperty("rows") long rows,
    @JsonProperty("throughput") double throughput,
    @JsonProperty("source") @NonNull ResultSource source) {

  public QueryOutcome {
    if (rows < 0) {
      throw new IllegalArgumentException("rows must be >= 0, got: " + rows);
    }
    if (latencySeconds < 0) {
      throw new IllegalArgumentException("latencySeconds must be >= 0, got: " + latencySeconds);
    }
  }

  /**
   * Builds the outcome of a real database execution.
   *
   * @param metrics sampled resource usage
   * @param latencySeconds measured latency
   * @param rows returned row count
   * @return outcome tagged {@link ResultSource#DB}
   */
  public static QueryOutcome fromExecution(
      final ResourceUsage metrics, final double latencySeconds, final long rows) {
    return new QueryOutcome(
        metrics, latencySeconds, rows, throughput(rows, latencySeconds), ResultSource.DB);
  }

  /** Rows per second; 0 when the latency is 0. */
  public static double throughput(final long rows, final double latencySeconds) {
    return latencySeconds > 0 ? rows / latencySeconds : 0.0;
  }

  public QueryOutcome withSource(final ResultSource newSource) {
    return new QueryOutcome(metrics, latencySeconds, rows, throughput, newSource);
  }
}
