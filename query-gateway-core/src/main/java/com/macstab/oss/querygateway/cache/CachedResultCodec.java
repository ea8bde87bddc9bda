/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.model.ResourceUsage;
import com.macstab.oss.querygateway.model.ResultSource;
import com.macstab.oss.querygateway.util.Jsons;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON form of a cached result: {@code {metrics, latency_s, rows, throughput, generated_at}}.
 *
 * <p>{@code generated_at} is epoch seconds of the original execution. Decoding never throws; an
 * unreadable payload is logged and reported as absent so the caller falls through to a real
 * execution.
 */
@Slf4j
public final class CachedResultCodec {

  record CachedResult(
      @JsonProperty("metrics") ResourceUsage metrics,
      @JsonProperty("latency_s") double latencySeconds,
      @JsonProperty("rows") long rows,
      @JsonProperty("throughput") double throughput,
      @JsonProperty("generated_at") double generatedAt) {}

  public String encode(@NonNull final QueryOutcome outcome, @NonNull final Instant generatedAt) {
    return Jsons.toJson(
        new CachedResult(
            outcome.metrics(),
            outcome.latencySeconds(),
            outcome.rows(),
            outcome.throughput(),
            generatedAt.toEpochMilli() / 1000.0));
  }

  /**
   * Decodes a stored payload into a cache-tagged outcome.
   *
   * @param payload stored JSON
   * @return outcome with {@link ResultSource#CACHE}, or empty if the payload is corrupt
   */
  public Optional<QueryOutcome> decode(@NonNull final String payload) {
    try {
      final var cached = Jsons.fromJson(payload, CachedResult.class);
      if (cached == null || !hasEveryPhase(cached.metrics())) {
        log.warn("Discarding cached payload with missing metrics");
        return Optional.empty();
      }
      return Optional.of(
          new QueryOutcome(
              cached.metrics(),
              cached.latencySeconds(),
              cached.rows(),
              cached.throughput(),
              ResultSource.CACHE));
    } catch (final IOException | IllegalArgumentException e) {
      log.warn("Discarding corrupt cached payload: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static boolean hasEveryPhase(final ResourceUsage usage) {
    return usage != null
        && Stream.of(usage.cpu(), usage.memoryMb(), usage.threads(), usage.fds(), usage.netKbps())
            .allMatch(Objects::nonNull);
  }
}
