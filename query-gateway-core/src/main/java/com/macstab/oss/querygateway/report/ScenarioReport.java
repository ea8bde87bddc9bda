/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.macstab.oss.querygateway.model.ResourceUsage;

/**
 * Aggregate of one maintenance cycle, serialized as the report's JSON summary.
 *
 * @param averageLatencySeconds mean of the client-reported latencies (0 when none)
 * @param averageThroughput mean throughput over the drained ledger
 * @param queries client latencies zipped with ledger throughput and rows
 * @param aggregatedMetrics phase-wise mean resource usage over the drained ledger
 * @param countCacheHits whether cache hits were recorded into the ledger
 * @param outcomeCount number of drained ledger entries
 */
@JsonPropertyOrder({
  "avg_latency_sec",
  "avg_throughput_rows_per_sec",
  "queries",
  "aggregated_metrics",
  "count_cache_in_scenario"
})
public record ScenarioReport(
    @JsonProperty("avg_latency_sec") double averageLatencySeconds,
    @JsonProperty("avg_throughput_rows_per_sec") double averageThroughput,
    @JsonProperty("queries") List<QuerySummary> queries,
    @JsonProperty("aggregated_metrics") ResourceUsage aggregatedMetrics,
    @JsonProperty("count_cache_in_scenario") boolean countCacheHits,
    @JsonIgnore int outcomeCount) {

  public ScenarioReport {
    queries = List.copyOf(queries);
  }
}
