/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.macstab.oss.querygateway.ledger.ResultLedger;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Maintenance cycle triggered by a priority-0 client.
 *
 * <p>Drains the whole ledger, across all clients, in one step; outcomes completed after the drain
 * belong to the next cycle. An empty ledger skips aggregation and rendering. An aggregation or
 * rendering failure is logged and never escapes; the drained outcomes are not put back.
 */
@Slf4j
public final class MaintenanceService {

  private final ResultLedger ledger;
  private final ScenarioAggregator aggregator;
  private final ReportRenderer renderer;

  public MaintenanceService(
      @NonNull final ResultLedger ledger,
      @NonNull final ScenarioAggregator aggregator,
      @NonNull final ReportRenderer renderer) {
    this.ledger = ledger;
    this.aggregator = aggregator;
    this.renderer = renderer;
  }

  /**
   * Runs one cycle.
   *
   * @param clientLatencies latencies reported by the maintenance client
   * @return the aggregated report, or empty if the ledger held nothing
   */
  public Optional<ScenarioReport> runMaintenance(@NonNull final List<Double> clientLatencies) {
    final var outcomes = ledger.drain();
    if (outcomes.isEmpty()) {
      log.warn("No results collected yet; skipping aggregation");
      return Optional.empty();
    }

    final ScenarioReport report;
    try {
      report = aggregator.aggregate(outcomes, clientLatencies);
    } catch (final RuntimeException e) {
      log.error("Failed to aggregate {} results; they are discarded", outcomes.size(), e);
      return Optional.empty();
    }

    try {
      final var rendered = renderer.render(report);
      if (log.isInfoEnabled()) {
        log.info(
            "Scenario complete over {} results: avg latency {}s, avg throughput {} rows/s; "
                + "figure {}, summary {}",
            report.outcomeCount(),
            String.format("%.4f", report.averageLatencySeconds()),
            String.format("%.2f", report.averageThroughput()),
            rendered.imagePath(),
            rendered.jsonPath());
      }
    } catch (final IOException | RuntimeException e) {
      log.error("Failed to write scenario report", e);
    }
    return Optional.of(report);
  }
}
