/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Metrics settings under {@code management.metrics.querygate}.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     querygate:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.querygate")
public class QueryGatewayMetricsProperties {

  /** Publish gateway meters when a {@code MeterRegistry} is present. */
  private boolean enabled = true;

  /** Upper bound of cached meter instances. */
  private int maxCacheSize = 1000;
}
