/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.model.ResourceUsage;

import lombok.NonNull;

/** Folds drained ledger outcomes and client latencies into a {@link ScenarioReport}. */
public final class ScenarioAggregator {

  private final boolean countCacheHits;

  public ScenarioAggregator(final boolean countCacheHits) {
    this.countCacheHits = countCacheHits;
  }

  /**
   * Builds the report. The {@code queries} list pairs the i-th client latency with the i-th
   * outcome and is as long as the shorter of the two lists.
   *
   * @param outcomes drained ledger, in completion order
   * @param clientLatencies latencies reported by the maintenance client, in seconds
   * @return aggregate report
   */
  public ScenarioReport aggregate(
      @NonNull final List<QueryOutcome> outcomes, @NonNull final List<Double> clientLatencies) {
    final var usage = ResourceUsage.average(outcomes.stream().map(QueryOutcome::metrics).toList());

    double throughputSum = 0.0;
    for (final var outcome : outcomes) {
      throughputSum += outcome.throughput();
    }
    final double averageThroughput = outcomes.isEmpty() ? 0.0 : throughputSum / outcomes.size();

    double latencySum = 0.0;
    for (final double latency : clientLatencies) {
      latencySum += latency;
    }
    final double averageLatency =
        clientLatencies.isEmpty() ? 0.0 : latencySum / clientLatencies.size();

    final int paired = Math.min(outcomes.size(), clientLatencies.size());
    final List<QuerySummary> queries = new ArrayList<>(paired);
    for (int i = 0; i < paired; i++) {
      final var outcome = outcomes.get(i);
      queries.add(new QuerySummary(clientLatencies.get(i), outcome.throughput(), outcome.rows()));
    }

    return new ScenarioReport(
        averageLatency, averageThroughput, queries, usage, countCacheHits, outcomes.size());
  }
}
