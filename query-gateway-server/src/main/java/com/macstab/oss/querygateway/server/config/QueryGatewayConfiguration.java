/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.querygateway.cache.CacheAccessException;
import com.macstab.oss.querygateway.cache.FallbackQueryCache;
import com.macstab.oss.querygateway.cache.InMemoryQueryCache;
import com.macstab.oss.querygateway.cache.QueryCache;
import com.macstab.oss.querygateway.cache.RedisQueryCache;
import com.macstab.oss.querygateway.dispatch.DispatcherPool;
import com.macstab.oss.querygateway.dispatch.QueryExecutor;
import com.macstab.oss.querygateway.engine.QueryEngine;
import com.macstab.oss.querygateway.instrument.InstrumentationCollector;
import com.macstab.oss.querygateway.instrument.JvmInstrumentationCollector;
import com.macstab.oss.querygateway.ledger.ResultLedger;
import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.pool.ConnectionPool;
import com.macstab.oss.querygateway.report.MaintenanceService;
import com.macstab.oss.querygateway.report.ReportRenderer;
import com.macstab.oss.querygateway.report.ScenarioAggregator;
import com.macstab.oss.querygateway.scheduler.AgingPriorityStrategy;
import com.macstab.oss.querygateway.scheduler.TaskQueue;
import com.macstab.oss.querygateway.server.jdbc.JdbcQueryEngine;
import com.macstab.oss.querygateway.server.protocol.ConnectionListener;
import com.macstab.oss.querygateway.server.protocol.ProtocolSettings;
import com.macstab.oss.querygateway.server.report.FileReportRenderer;

import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the serving pipeline from {@link QueryGatewayProperties}.
 *
 * <p>Every shared structure (queue, pool, ledger, cache) is a singleton bean injected into the
 * dispatcher and the listener; nothing lives in static state. Beans marked {@code
 * ConditionalOnMissingBean} can be replaced by the application, which is how tests swap in a stub
 * database.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(QueryGatewayProperties.class)
public class QueryGatewayConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock queryGatewayClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public QueryEngine queryEngine(final QueryGatewayProperties properties) {
    final var db = properties.getDatabase();
    return new JdbcQueryEngine(
        db.getUrl(), db.getUsername(), db.getPassword(), db.getValidationTimeout());
  }

  @Bean(destroyMethod = "destroy")
  public ConnectionPool connectionPool(
      final QueryEngine engine,
      final QueryGatewayProperties properties,
      final QueryGatewayMetrics metrics) {
    return new ConnectionPool(engine, properties.getPool().getSize(), metrics, "querygate");
  }

  /**
   * Redis behind an in-process fallback, or the in-process cache alone.
   *
   * <p>Redis unreachable at startup is not fatal: the in-process cache serves from the start.
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public QueryCache queryCache(
      final QueryGatewayProperties properties, final QueryGatewayMetrics metrics) {
    final var cache = properties.getCache();
    if (!cache.isEnabled()) {
      log.info("Redis cache disabled; using in-memory query cache");
      return new InMemoryQueryCache();
    }
    final var uri =
        RedisURI.builder()
            .withHost(cache.getHost())
            .withPort(cache.getPort())
            .withDatabase(cache.getDatabase())
            .build();
    try {
      final var redis = RedisQueryCache.connect(uri, cache.getConnectTimeout());
      return new FallbackQueryCache(redis, new InMemoryQueryCache(), metrics);
    } catch (final CacheAccessException e) {
      log.warn("Redis unavailable ({}); using in-memory query cache", e.getMessage());
      return new InMemoryQueryCache();
    }
  }

  @Bean
  public TaskQueue taskQueue(final Clock clock, final QueryGatewayMetrics metrics) {
    return new TaskQueue(new AgingPriorityStrategy(), clock, metrics);
  }

  @Bean
  public ResultLedger resultLedger() {
    return new ResultLedger();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public InstrumentationCollector instrumentationCollector(
      final QueryGatewayProperties properties) {
    final var instrumentation = properties.getInstrumentation();
    return new JvmInstrumentationCollector(
        instrumentation.getSampleInterval(),
        instrumentation.getRateWindow(),
        instrumentation.getSettleDelay());
  }

  @Bean
  public QueryExecutor queryExecutor(
      final QueryCache cache,
      final InstrumentationCollector collector,
      final ResultLedger ledger,
      final QueryGatewayMetrics metrics,
      final QueryGatewayProperties properties,
      final Clock clock) {
    return QueryExecutor.builder()
        .cache(cache)
        .collector(collector)
        .ledger(ledger)
        .metrics(metrics)
        .ttl(properties.getCache().getTtl())
        .keyPrefix(properties.getCache().getKeyPrefix())
        .countCacheHits(properties.getScenario().isCountCacheHits())
        .clock(clock)
        .build();
  }

  @Bean
  public DispatcherPool dispatcherPool(
      final ConnectionPool pool,
      final TaskQueue queue,
      final QueryExecutor executor,
      final QueryGatewayMetrics metrics,
      final QueryGatewayProperties properties) {
    return new DispatcherPool(
        pool, queue, executor, metrics, properties.getDispatcher().getIdleBackoff());
  }

  @Bean
  public DispatcherLifecycle dispatcherLifecycle(
      final DispatcherPool dispatcher, final QueryGatewayProperties properties) {
    return new DispatcherLifecycle(dispatcher, properties.getDispatcher().getShutdownGrace());
  }

  @Bean
  @ConditionalOnMissingBean
  public ReportRenderer reportRenderer(final QueryGatewayProperties properties) {
    return new FileReportRenderer(Path.of(properties.getReport().getOutputDir()));
  }

  @Bean
  public MaintenanceService maintenanceService(
      final ResultLedger ledger,
      final ReportRenderer renderer,
      final QueryGatewayProperties properties) {
    return new MaintenanceService(
        ledger, new ScenarioAggregator(properties.getScenario().isCountCacheHits()), renderer);
  }

  @Bean(destroyMethod = "close")
  public ConnectionListener connectionListener(
      final TaskQueue queue,
      final MaintenanceService maintenance,
      final QueryGatewayProperties properties,
      final Clock clock) {
    final var server = properties.getServer();
    return new ConnectionListener(
        server.getHost(),
        server.getPort(),
        queue,
        maintenance,
        new ProtocolSettings(
            server.getHandshakeMaxBytes(),
            server.getReceiveBufferBytes(),
            server.getMaintenanceBufferBytes()),
        clock);
  }
}
