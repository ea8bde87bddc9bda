/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Unbounded queue of pending tasks with pluggable selection.
 *
 * <p><strong>Locking:</strong> One {@link ReentrantLock} guards the list. Enqueue and selection are
 * short critical sections; no I/O ever runs under the lock. Workers waiting for work park on the
 * {@code notEmpty} condition, which every enqueue signals, instead of polling on a sleep.
 *
 * <p><strong>Order:</strong> The list keeps enqueue order. Which task leaves is decided solely by
 * the {@link TaskSelectionStrategy}; enqueue order only matters as its tie-break.
 */
@Slf4j
public final class TaskQueue {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final List<Task> pending = new ArrayList<>();
  @Getter private final TaskSelectionStrategy strategy;
  private final Clock clock;
  private final QueryGatewayMetrics metrics;

  public TaskQueue() {
    this(new AgingPriorityStrategy(), Clock.systemUTC(), QueryGatewayMetrics.NOOP);
  }

  public TaskQueue(
      @NonNull final TaskSelectionStrategy strategy,
      @NonNull final Clock clock,
      @NonNull final QueryGatewayMetrics metrics) {
    this.strategy = strategy;
    this.clock = clock;
    this.metrics = metrics;
  }

  /**
   * Appends a task and wakes one waiting worker.
   *
   * @param task task to queue
   */
  public void enqueue(@NonNull final Task task) {
    lock.lock();
    try {
      pending.add(task);
      metrics.setQueueDepth(pending.size());
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
    metrics.recordTaskEnqueued(task.priority());
    if (log.isDebugEnabled()) {
      log.debug("Queued task from client {} with priority {}", task.clientId(), task.priority());
    }
  }

  /**
   * Removes and returns the task chosen by the strategy, without waiting.
   *
   * @return chosen task, or empty if nothing is pending
   */
  public Optional<Task> selectAndRemove() {
    lock.lock();
    try {
      return removeSelected();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for a task, then removes and returns the chosen one.
   *
   * @param timeout maximum wait on an empty queue
   * @return chosen task, or empty if the queue stayed empty
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<Task> awaitAndSelect(@NonNull final Duration timeout)
      throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (pending.isEmpty()) {
        if (remaining <= 0L) {
          return Optional.empty();
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return removeSelected();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock.
  private Optional<Task> removeSelected() {
    if (pending.isEmpty()) {
      return Optional.empty();
    }
    final var now = clock.instant();
    final var task = pending.remove(strategy.select(pending, now));
    metrics.setQueueDepth(pending.size());
    metrics.recordTaskSelected(task.priority(), Duration.between(task.enqueuedAt(), now));
    return Optional.of(task);
  }
}
