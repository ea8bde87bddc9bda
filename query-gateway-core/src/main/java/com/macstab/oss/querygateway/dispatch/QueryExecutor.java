/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.querygateway.cache.CachedResultCodec;
import com.macstab.oss.querygateway.cache.QueryCache;
import com.macstab.oss.querygateway.cache.QueryFingerprint;
import com.macstab.oss.querygateway.engine.QueryExecutionException;
import com.macstab.oss.querygateway.engine.QueryRows;
import com.macstab.oss.querygateway.instrument.InstrumentationCollector;
import com.macstab.oss.querygateway.instrument.Measurement;
import com.macstab.oss.querygateway.ledger.ResultLedger;
import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.model.ResultSource;
import com.macstab.oss.querygateway.pool.PooledConnection;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache-aside execution of one query on a borrowed connection.
 *
 * <p><strong>Hit:</strong> the stored payload is decoded and returned tagged {@code cache}; it is
 * recorded into the ledger only when {@code countCacheHits} is set. The connection is not touched.
 *
 * <p><strong>Miss:</strong> the query runs under the {@link InstrumentationCollector}, the outcome
 * is appended to the ledger tagged {@code db}, then stored in the cache with {@code ttl}. Ledger
 * append comes first so a cache fault can never lose a recorded result.
 *
 * <p>No lock is held while the query or the cache call runs.
 */
@Slf4j
public final class QueryExecutor {

  private final QueryCache cache;
  private final CachedResultCodec codec;
  private final InstrumentationCollector collector;
  private final ResultLedger ledger;
  private final QueryGatewayMetrics metrics;
  private final Duration ttl;
  private final String keyPrefix;
  private final boolean countCacheHits;
  private final Clock clock;

  @Builder
  private QueryExecutor(
      @NonNull final QueryCache cache,
      @NonNull final InstrumentationCollector collector,
      @NonNull final ResultLedger ledger,
      final QueryGatewayMetrics metrics,
      @NonNull final Duration ttl,
      final String keyPrefix,
      final boolean countCacheHits,
      final Clock clock) {
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
    }
    this.cache = cache;
    this.codec = new CachedResultCodec();
    this.collector = collector;
    this.ledger = ledger;
    this.metrics = metrics != null ? metrics : QueryGatewayMetrics.NOOP;
    this.ttl = ttl;
    this.keyPrefix = keyPrefix != null ? keyPrefix : QueryFingerprint.DEFAULT_PREFIX;
    this.countCacheHits = countCacheHits;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Answers {@code sql} from the cache or by running it on {@code connection}.
   *
   * @param sql opaque query text
   * @param connection connection borrowed by the calling worker
   * @return outcome tagged with its source
   * @throws QueryExecutionException if the query fails
   */
  public QueryOutcome execute(
      @NonNull final String sql, @NonNull final PooledConnection connection) {
    final String key = QueryFingerprint.fingerprint(keyPrefix, sql);

    final var hit = lookup(key).flatMap(codec::decode);
    if (hit.isPresent()) {
      final var outcome = hit.get();
      metrics.recordCacheHit();
      metrics.recordQueryCompleted(
          ResultSource.CACHE, seconds(outcome.latencySeconds()), outcome.rows());
      if (countCacheHits) {
        ledger.append(outcome);
      }
      return outcome;
    }
    metrics.recordCacheMiss();

    final var measurement = measure(sql, connection);
    final var outcome =
        QueryOutcome.fromExecution(
            measurement.usage(), measurement.latencySeconds(), measurement.result().rowCount());
    ledger.append(outcome);
    metrics.recordQueryCompleted(
        ResultSource.DB, seconds(outcome.latencySeconds()), outcome.rows());

    try {
      cache.put(key, codec.encode(outcome, clock.instant()), ttl);
    } catch (final RuntimeException e) {
      metrics.recordCacheError("put");
      log.warn("Dropping cache write for {}: {}", key, e.getMessage());
    }
    return outcome;
  }

  private Optional<String> lookup(final String key) {
    try {
      return cache.get(key);
    } catch (final RuntimeException e) {
      metrics.recordCacheError("get");
      log.warn("Treating failed cache read of {} as a miss: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  private Measurement<QueryRows> measure(
      final String sql, final PooledConnection connection) {
    try {
      return collector.measure(() -> connection.execute(sql));
    } catch (final QueryExecutionException e) {
      throw e;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted while executing query", e);
    } catch (final Exception e) {
      throw new QueryExecutionException("Query execution failed: " + e.getMessage(), e);
    }
  }

  private static Duration seconds(final double value) {
    return Duration.ofNanos((long) (value * 1_000_000_000L));
  }
}
