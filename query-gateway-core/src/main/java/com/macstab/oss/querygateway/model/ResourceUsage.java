/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.model;

import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource-usage deltas of one query call across the three phases.
 *
 * <p>JSON field names are part of the wire reply and of the cached payload, so they are pinned
 * with {@link JsonProperty}.
 *
 * @param cpu CPU utilisation in percent
 * @param memoryMb resident memory in MiB
 * @param threads live thread count
 * @param fds open file descriptor count (0 where the platform does not expose it)
 * @param netKbps network throughput in KiB/s
 */
public record ResourceUsage(
    @JsonProperty("cpu") PhaseMetrics cpu,
    @JsonProperty("memory_mb") PhaseMetrics memoryMb,
    @JsonProperty("threads") PhaseMetrics threads,
    @JsonProperty("fds") PhaseMetrics fds,
    @JsonProperty("net_kbps") PhaseMetrics netKbps) {

  public static final ResourceUsage ZERO =
      new ResourceUsage(
          PhaseMetrics.ZERO, PhaseMetrics.ZERO, PhaseMetrics.ZERO, PhaseMetrics.ZERO,
          PhaseMetrics.ZERO);

  /**
   * Averages each resource phase-wise over all given usages.
   *
   * @param usages usages to aggregate (empty yields {@link #ZERO})
   * @return aggregated usage
   */
  public static ResourceUsage average(final List<ResourceUsage> usages) {
    if (usages.isEmpty()) {
      return ZERO;
    }
    return new ResourceUsage(
        averageOf(usages, ResourceUsage::cpu),
        averageOf(usages, ResourceUsage::memoryMb),
        averageOf(usages, ResourceUsage::threads),
        averageOf(usages, ResourceUsage::fds),
        averageOf(usages, ResourceUsage::netKbps));
  }

  private static PhaseMetrics averageOf(
      final List<ResourceUsage> usages, final Function<ResourceUsage, PhaseMetrics> resource) {
    return PhaseMetrics.average(usages.stream().map(resource).toList());
  }
}
