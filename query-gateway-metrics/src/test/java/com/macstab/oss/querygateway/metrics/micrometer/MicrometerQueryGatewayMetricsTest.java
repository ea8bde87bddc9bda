/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.metrics.micrometer;

import static com.macstab.oss.querygateway.metrics.micrometer.MetricsConfiguration.*;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.querygateway.model.ResultSource;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MicrometerQueryGatewayMetrics}.
 *
 * <p>Each recording method is checked against the meter it should move in a {@link
 * SimpleMeterRegistry}.
 */
@DisplayName("MicrometerQueryGatewayMetrics")
class MicrometerQueryGatewayMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerQueryGatewayMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerQueryGatewayMetrics(registry);
  }

  @Nested
  @DisplayName("Scheduler")
  class Scheduler {

    @Test
    @DisplayName("counts enqueued tasks per priority")
    void recordTaskEnqueued() {
      // Act
      metrics.recordTaskEnqueued(5);
      metrics.recordTaskEnqueued(5);
      metrics.recordTaskEnqueued(1);

      // Assert
      assertThat(registry.get(TASKS_ENQUEUED).tag(TAG_PRIORITY, "5").counter().count())
          .isEqualTo(2.0);
      assertThat(registry.get(TASKS_ENQUEUED).tag(TAG_PRIORITY, "1").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("times queue wait of selected tasks")
    void recordTaskSelected() {
      // Act
      metrics.recordTaskSelected(9, Duration.ofMillis(250));

      // Assert
      final var timer = registry.get(TASK_WAIT).tag(TAG_PRIORITY, "9").timer();
      assertThat(timer.count()).isEqualTo(1);
      assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }

    @Test
    @DisplayName("gauges queue depth")
    void setQueueDepth() {
      // Act
      metrics.setQueueDepth(3);
      metrics.setQueueDepth(1);

      // Assert
      assertThat(registry.get(QUEUE_DEPTH).gauge().value()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Pool")
  class Pool {

    @Test
    @DisplayName("gauges borrowed connections per pool")
    void setConnectionsInUse() {
      // Act
      metrics.setConnectionsInUse("querygate", 4);

      // Assert
      assertThat(registry.get(POOL_IN_USE).tag(TAG_POOL_NAME, "querygate").gauge().value())
          .isEqualTo(4.0);
    }

    @Test
    @DisplayName("counts replacements and ignores negative slots")
    void recordConnectionReplaced() {
      // Act
      metrics.recordConnectionReplaced("querygate", 2);
      metrics.recordConnectionReplaced("querygate", -1);

      // Assert
      assertThat(registry.get(POOL_REPLACEMENTS).tag(TAG_POOL_NAME, "querygate").counter().count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Cache and queries")
  class CacheAndQueries {

    @Test
    @DisplayName("counts hits and misses under one meter name")
    void recordCacheRequests() {
      // Act
      metrics.recordCacheHit();
      metrics.recordCacheMiss();
      metrics.recordCacheMiss();

      // Assert
      assertThat(registry.get(CACHE_REQUESTS).tag(TAG_RESULT, RESULT_HIT).counter().count())
          .isEqualTo(1.0);
      assertThat(registry.get(CACHE_REQUESTS).tag(TAG_RESULT, RESULT_MISS).counter().count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("counts cache errors per operation")
    void recordCacheError() {
      // Act
      metrics.recordCacheError("put");

      // Assert
      assertThat(registry.get(CACHE_ERRORS).tag(TAG_OPERATION, "put").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("records latency and rows per source")
    void recordQueryCompleted() {
      // Act
      metrics.recordQueryCompleted(ResultSource.DB, Duration.ofMillis(100), 42);
      metrics.recordQueryCompleted(ResultSource.CACHE, Duration.ofMillis(100), 42);

      // Assert
      assertThat(registry.get(QUERY_LATENCY).tag(TAG_SOURCE, "db").timer().count()).isEqualTo(1);
      assertThat(registry.get(QUERY_ROWS).tag(TAG_SOURCE, "cache").counter().count())
          .isEqualTo(42.0);
    }

    @Test
    @DisplayName("counts failures")
    void recordQueryFailed() {
      // Act
      metrics.recordQueryFailed();

      // Assert
      assertThat(registry.get(QUERY_FAILURES).counter().count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Close")
  class Close {

    @Test
    @DisplayName("removes meters and turns recording into a no-op")
    void close_StopsRecording() {
      // Arrange
      metrics.recordQueryFailed();
      assertThat(metrics.getCacheSize()).isEqualTo(1);

      // Act
      metrics.close();
      metrics.recordQueryFailed();
      metrics.close();

      // Assert
      assertThat(metrics.getCacheSize()).isZero();
      assertThat(registry.find(QUERY_FAILURES).counter()).isNull();
    }
  }
}
