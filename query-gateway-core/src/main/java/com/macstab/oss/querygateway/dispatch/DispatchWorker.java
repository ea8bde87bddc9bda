/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.dispatch;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;
import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.pool.ConnectionPool;
import com.macstab.oss.querygateway.pool.PooledConnection;
import com.macstab.oss.querygateway.scheduler.Task;
import com.macstab.oss.querygateway.scheduler.TaskQueue;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * One dispatcher loop: borrow a connection, take the best task, execute, reply, return.
 *
 * <p><strong>Lock order:</strong> pool (borrow) → queue (select, released immediately) → no lock
 * during execution → ledger (inside the executor) → pool (return). Locks are never nested.
 *
 * <p><strong>Idle:</strong> with a connection in hand the worker parks on the queue's condition for
 * at most {@code idleBackoff}, then returns the connection and goes round again, so a stop request
 * is seen within one backoff interval.
 *
 * <p><strong>Failures:</strong> an execution failure is logged, counted and answered with an error
 * reply; the connection goes back through {@link ConnectionPool#releaseAfterFailure} and the loop
 * continues. Only interruption ends the loop early.
 *
 * <p>A task whose client has gone still runs and reaches the ledger; only its reply is skipped.
 */
@Slf4j
final class DispatchWorker implements Runnable {

  private final ConnectionPool pool;
  private final TaskQueue queue;
  private final QueryExecutor executor;
  private final QueryGatewayMetrics metrics;
  private final Duration idleBackoff;
  private final BooleanSupplier running;

  DispatchWorker(
      @NonNull final ConnectionPool pool,
      @NonNull final TaskQueue queue,
      @NonNull final QueryExecutor executor,
      @NonNull final QueryGatewayMetrics metrics,
      @NonNull final Duration idleBackoff,
      @NonNull final BooleanSupplier running) {
    this.pool = pool;
    this.queue = queue;
    this.executor = executor;
    this.metrics = metrics;
    this.idleBackoff = idleBackoff;
    this.running = running;
  }

  @Override
  public void run() {
    if (log.isDebugEnabled()) {
      log.debug("{} started", Thread.currentThread().getName());
    }
    try {
      while (running.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
        runOnce();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (log.isDebugEnabled()) {
      log.debug("{} stopped", Thread.currentThread().getName());
    }
  }

  /**
   * Runs a single iteration.
   *
   * @return {@code true} if a task was executed
   * @throws InterruptedException if interrupted while waiting for a connection or a task
   */
  boolean runOnce() throws InterruptedException {
    final var borrowed = pool.tryAcquire(idleBackoff);
    if (borrowed.isEmpty()) {
      return false;
    }
    final PooledConnection connection = borrowed.get();
    boolean failed = false;
    try {
      final var next = queue.awaitAndSelect(idleBackoff);
      if (next.isEmpty()) {
        return false;
      }
      failed = !executeAndReply(next.get(), connection);
      return true;
    } finally {
      if (failed) {
        pool.releaseAfterFailure(connection);
      } else {
        pool.release(connection);
      }
    }
  }

  private boolean executeAndReply(final Task task, final PooledConnection connection) {
    final QueryOutcome outcome;
    try {
      outcome = executor.execute(task.query(), connection);
    } catch (final RuntimeException e) {
      metrics.recordQueryFailed();
      log.error("Query from client {} failed: {}", task.clientId(), e.getMessage(), e);
      if (task.replyTo().isOpen()) {
        task.replyTo().replyError(describe(e));
      }
      return false;
    }
    if (!task.replyTo().isOpen()) {
      log.debug("Client {} is gone; dropping reply", task.clientId());
      return true;
    }
    task.replyTo().reply(outcome);
    if (log.isDebugEnabled()) {
      log.debug(
          "Task done for client {}: source={}, rows={}, latency={}s",
          task.clientId(), outcome.source().wireName(), outcome.rows(), outcome.latencySeconds());
    }
    return true;
  }

  private static String describe(final RuntimeException e) {
    final String message = e.getMessage();
    return message != null ? message : e.getClass().getSimpleName();
  }
}
