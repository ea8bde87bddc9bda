/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.dispatch;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.querygateway.cache.InMemoryQueryCache;
import com.macstab.oss.querygateway.ledger.ResultLedger;
import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.model.ResultSource;
import com.macstab.oss.querygateway.pool.ConnectionPool;
import com.macstab.oss.querygateway.scheduler.AgingPriorityStrategy;
import com.macstab.oss.querygateway.scheduler.Task;
import com.macstab.oss.querygateway.scheduler.TaskQueue;
import com.macstab.oss.querygateway.testutil.DirectCollector;
import com.macstab.oss.querygateway.testutil.RecordingReplyChannel;
import com.macstab.oss.querygateway.testutil.StubQueryEngine;

/**
 * Tests for {@link DispatcherPool} and {@link DispatchWorker}.
 *
 * <p>Real pool, queue, ledger and in-memory cache; only the database and the instrumentation are
 * stubbed.
 */
@DisplayName("DispatcherPool")
class DispatcherPoolTest {

  private static final Duration BACKOFF = Duration.ofMillis(20);

  private StubQueryEngine engine;
  private ConnectionPool pool;
  private TaskQueue queue;
  private ResultLedger ledger;
  private QueryGatewayMetrics metrics;
  private QueryExecutor executor;
  private DispatcherPool dispatcher;

  @BeforeEach
  void setUp() {
    engine = new StubQueryEngine(sql -> sql.length());
    pool = new ConnectionPool(engine, 3);
    queue = new TaskQueue();
    ledger = new ResultLedger();
    metrics = mock(QueryGatewayMetrics.class);
    executor =
        QueryExecutor.builder()
            .cache(new InMemoryQueryCache())
            .collector(new DirectCollector(0.01))
            .ledger(ledger)
            .metrics(metrics)
            .ttl(Duration.ofSeconds(300))
            .countCacheHits(true)
            .build();
    dispatcher = new DispatcherPool(pool, queue, executor, metrics, BACKOFF);
  }

  @AfterEach
  void tearDown() {
    dispatcher.stop(Duration.ofSeconds(2));
    pool.destroy();
  }

  private Task task(final RecordingReplyChannel reply, final int priority, final String sql) {
    return new Task(reply, "client", priority, Clock.systemUTC().instant(), sql);
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("runs one worker per pooled connection")
    void workerCount_EqualsPoolSize() {
      assertThat(dispatcher.getWorkerCount()).isEqualTo(pool.getSize());
    }

    @Test
    @DisplayName("cannot be started twice")
    void start_Twice() {
      dispatcher.start();

      assertThat(dispatcher.isRunning()).isTrue();
      assertThatThrownBy(dispatcher::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("stop is idempotent and returns every connection")
    void stop_ReturnsConnections() {
      // Arrange
      dispatcher.start();

      // Act
      dispatcher.stop(Duration.ofSeconds(2));
      dispatcher.stop(Duration.ofSeconds(2));

      // Assert
      assertThat(dispatcher.isRunning()).isFalse();
      await().atMost(2, SECONDS).until(() -> pool.getIdleCount() == pool.getSize());
    }
  }

  @Nested
  @DisplayName("Dispatch")
  class Dispatch {

    @Test
    @DisplayName("answers every queued task exactly once")
    void dispatch_AnswersAllTasks() {
      // Arrange
      final var reply = new RecordingReplyChannel();
      for (int i = 0; i < 50; i++) {
        queue.enqueue(task(reply, 1 + i % 9, "SELECT " + i));
      }

      // Act
      dispatcher.start();

      // Assert
      await().atMost(5, SECONDS).until(() -> reply.getOutcomes().size() == 50);
      assertThat(reply.getErrors()).isEmpty();
      assertThat(queue.size()).isZero();
      assertThat(ledger.size()).isEqualTo(50);
    }

    @Test
    @DisplayName("answers a repeated query from the cache")
    void dispatch_SecondCallHitsCache() {
      // Arrange
      final var reply = new RecordingReplyChannel();
      dispatcher.start();

      // Act
      queue.enqueue(task(reply, 5, "SELECT 1"));
      await().atMost(2, SECONDS).until(() -> reply.getOutcomes().size() == 1);
      queue.enqueue(task(reply, 5, "SELECT 1"));
      await().atMost(2, SECONDS).until(() -> reply.getOutcomes().size() == 2);

      // Assert
      assertThat(reply.getOutcomes())
          .extracting(QueryOutcome::source)
          .containsExactly(ResultSource.DB, ResultSource.CACHE);
      assertThat(engine.getExecutions()).isEqualTo(1);
    }

    @Test
    @DisplayName("replies with an error and keeps serving after a failed query")
    void dispatch_FailureDoesNotKillWorker() {
      // Arrange
      final var reply = new RecordingReplyChannel();
      dispatcher.start();

      // Act
      queue.enqueue(task(reply, 5, "SELECT FAIL"));
      queue.enqueue(task(reply, 5, "SELECT 2"));

      // Assert
      await()
          .atMost(2, SECONDS)
          .until(() -> reply.getErrors().size() == 1 && reply.getOutcomes().size() == 1);
      assertThat(reply.getErrors().get(0)).contains("FAIL");
      verify(metrics).recordQueryFailed();
      await().atMost(2, SECONDS).until(() -> pool.getIdleCount() == pool.getSize());
    }

    @Test
    @DisplayName("still runs a task of a disconnected client but skips its reply")
    void dispatch_DisconnectedClient() {
      // Arrange
      final var gone = new RecordingReplyChannel();
      gone.disconnect();
      final var live = new RecordingReplyChannel();
      queue.enqueue(task(gone, 9, "SELECT 1"));
      queue.enqueue(task(gone, 9, "SELECT FAIL"));

      // Act
      dispatcher.start();
      queue.enqueue(task(live, 1, "SELECT 2"));

      // Assert
      await().atMost(2, SECONDS).until(() -> live.getOutcomes().size() == 1);
      await().atMost(2, SECONDS).until(() -> engine.getExecutions() == 3);
      assertThat(gone.getOutcomes()).isEmpty();
      assertThat(gone.getErrors()).isEmpty();
      await().atMost(2, SECONDS).until(() -> ledger.size() == 2);
    }

    @Test
    @DisplayName("replaces a dead session after a failure")
    void dispatch_ReplacesDeadSession() {
      // Arrange
      final var reply = new RecordingReplyChannel();
      engine.getSessions().forEach(StubQueryEngine.StubSession::invalidate);
      dispatcher.start();

      // Act
      queue.enqueue(task(reply, 5, "SELECT FAIL"));

      // Assert
      await().atMost(2, SECONDS).until(() -> reply.getErrors().size() == 1);
      await().atMost(2, SECONDS).until(() -> engine.getSessions().size() == 4);
      assertThat(pool.getSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("never runs more queries at once than there are connections")
    void dispatch_ConcurrencyBoundedByPool() {
      // Arrange
      final var active = new AtomicInteger();
      final var peak = new AtomicInteger();
      final Set<String> seen = ConcurrentHashMap.newKeySet();
      final var duplicate = new AtomicBoolean(false);
      final var slowEngine =
          new StubQueryEngine(
              sql -> {
                final int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                  Thread.sleep(5);
                } catch (final InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
                if (!seen.add(sql)) {
                  duplicate.set(true);
                }
                active.decrementAndGet();
                return 1L;
              });
      final var slowPool = new ConnectionPool(slowEngine, 2);
      final var slowDispatcher = new DispatcherPool(slowPool, queue, executor, metrics, BACKOFF);
      final var reply = new RecordingReplyChannel();
      for (int i = 0; i < 40; i++) {
        queue.enqueue(task(reply, 3, "SELECT " + i));
      }

      // Act
      slowDispatcher.start();

      // Assert
      try {
        await().atMost(5, SECONDS).until(() -> reply.getOutcomes().size() == 40);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(duplicate).isFalse();
      } finally {
        slowDispatcher.stop(Duration.ofSeconds(2));
        slowPool.destroy();
      }
    }
  }

  @Test
  @DisplayName("rejects a non-positive idle backoff")
  void constructor_RejectsZeroBackoff() {
    assertThatThrownBy(() -> new DispatcherPool(pool, queue, executor, metrics, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
