/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.dispatch;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.pool.ConnectionPool;
import com.macstab.oss.querygateway.scheduler.TaskQueue;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed set of dispatcher workers, one per pooled connection.
 *
 * <p><strong>Lifecycle:</strong> {@code NEW → RUNNING → STOPPED}, one way. {@link #stop(Duration)}
 * stops new iterations, waits up to the grace period for tasks in flight, then interrupts whatever
 * is left. Pending tasks in the queue are not drained.
 */
@Slf4j
public final class DispatcherPool {

  private enum State {
    NEW,
    RUNNING,
    STOPPED
  }

  @Getter private final int workerCount;
  private final ConnectionPool pool;
  private final TaskQueue queue;
  private final QueryExecutor executor;
  private final QueryGatewayMetrics metrics;
  private final Duration idleBackoff;
  private final AtomicReference<State> state;
  private volatile ExecutorService workers;

  public DispatcherPool(
      @NonNull final ConnectionPool pool,
      @NonNull final TaskQueue queue,
      @NonNull final QueryExecutor executor,
      @NonNull final QueryGatewayMetrics metrics,
      @NonNull final Duration idleBackoff) {
    if (idleBackoff.isZero() || idleBackoff.isNegative()) {
      throw new IllegalArgumentException("idleBackoff must be positive, got: " + idleBackoff);
    }
    this.workerCount = pool.getSize();
    this.pool = pool;
    this.queue = queue;
    this.executor = executor;
    this.metrics = metrics;
    this.idleBackoff = idleBackoff;
    this.state = new AtomicReference<>(State.NEW);
  }

  /**
   * Starts all workers.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public void start() {
    if (!state.compareAndSet(State.NEW, State.RUNNING)) {
      throw new IllegalStateException("DispatcherPool already " + state.get());
    }
    final var counter = new AtomicInteger();
    workers =
        Executors.newFixedThreadPool(
            workerCount,
            runnable -> {
              final var thread =
                  new Thread(runnable, "querygate-dispatcher-" + counter.getAndIncrement());
              thread.setDaemon(true);
              return thread;
            });
    for (int i = 0; i < workerCount; i++) {
      workers.execute(
          new DispatchWorker(pool, queue, executor, metrics, idleBackoff, this::isRunning));
    }
    if (log.isInfoEnabled()) {
      log.info(
          "Started {} dispatcher workers (strategy: {})",
          workerCount,
          queue.getStrategy().getName());
    }
  }

  /**
   * Stops the workers, waiting at most {@code grace} for tasks in flight.
   *
   * <p>Idempotent.
   *
   * @param grace maximum wait before interrupting
   */
  public void stop(@NonNull final Duration grace) {
    final var previous = state.getAndSet(State.STOPPED);
    if (previous != State.RUNNING) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(grace.toNanos(), TimeUnit.NANOSECONDS)) {
        log.warn("Dispatcher workers still busy after {}, interrupting", grace);
        workers.shutdownNow();
      }
    } catch (final InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (log.isInfoEnabled()) {
      log.info("Stopped dispatcher workers ({} tasks left queued)", queue.size());
    }
  }

  public boolean isRunning() {
    return state.get() == State.RUNNING;
  }
}
