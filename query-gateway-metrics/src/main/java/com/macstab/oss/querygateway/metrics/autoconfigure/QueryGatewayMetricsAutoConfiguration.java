/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.metrics.micrometer.MicrometerQueryGatewayMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes {@link QueryGatewayMetrics}.
 *
 * <p>With a {@link MeterRegistry} bean and {@code management.metrics.querygate.enabled} not
 * {@code false}, the Micrometer implementation is registered; otherwise the {@link
 * QueryGatewayMetrics#NOOP} singleton. A user-defined {@link QueryGatewayMetrics} bean wins over
 * both.
 *
 * <p>Runs after the Actuator metrics auto-configuration so the registry bean is visible to the
 * {@code @ConditionalOnBean} check.
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics"
          + ".CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple"
          + ".SimpleMetricsExportAutoConfiguration"
    })
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(QueryGatewayMetricsProperties.class)
public class QueryGatewayMetricsAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.querygate",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(QueryGatewayMetrics.class)
  public QueryGatewayMetrics micrometerQueryGatewayMetrics(
      final MeterRegistry registry, final QueryGatewayMetricsProperties properties) {
    log.info(
        "Activating query gateway metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());
    return new MicrometerQueryGatewayMetrics(registry, properties.getMaxCacheSize());
  }

  /** Fallback when metrics are disabled or no registry exists. */
  @Bean
  @ConditionalOnMissingBean(QueryGatewayMetrics.class)
  public QueryGatewayMetrics noOpQueryGatewayMetrics() {
    log.debug("Query gateway metrics disabled - using NOOP singleton");
    return QueryGatewayMetrics.NOOP;
  }
}
