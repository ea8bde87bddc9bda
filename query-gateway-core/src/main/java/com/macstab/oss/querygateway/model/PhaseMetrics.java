/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.model;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * One resource figure sampled in three phases around a query call: before, during, after.
 *
 * @param pre value sampled before the call
 * @param during average over the samples taken while the call ran
 * @param post value sampled after the call settled
 */
public record PhaseMetrics(double pre, double during, double post) {

  public static final PhaseMetrics ZERO = new PhaseMetrics(0.0, 0.0, 0.0);

  /**
   * Phase-wise arithmetic mean. Empty input yields {@link #ZERO}.
   *
   * @param values phase metrics to average
   * @return phase-wise mean
   */
  public static PhaseMetrics average(final List<PhaseMetrics> values) {
    if (values.isEmpty()) {
      return ZERO;
    }
    return new PhaseMetrics(
        mean(values, PhaseMetrics::pre),
        mean(values, PhaseMetrics::during),
        mean(values, PhaseMetrics::post));
  }

  private static double mean(
      final List<PhaseMetrics> values, final ToDoubleFunction<PhaseMetrics> phase) {
    double sum = 0.0;
    for (final var value : values) {
      sum += phase.applyAsDouble(value);
    }
    return sum / values.size();
  }
}
