/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a scenario report.
 *
 * @param latencySeconds client-reported latency
 * @param throughput server-side rows per second of the matching ledger entry
 * @param rows row count of the matching ledger entry
 */
public record QuerySummary(
    @JsonProperty("latency_sec") double latencySeconds,
    @JsonProperty("throughput_rows_per_sec") double throughput,
    @JsonProperty("rows") long rows) {}
