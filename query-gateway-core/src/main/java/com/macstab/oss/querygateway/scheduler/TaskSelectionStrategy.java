/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Picks which pending task a free dispatcher worker runs next.
 *
 * <p><strong>Thread safety:</strong> {@link #select(List, Instant)} is always called by {@link
 * TaskQueue} under its lock, so implementations see a stable list and need no synchronization of
 * their own. They MUST NOT block.
 *
 * @see AgingPriorityStrategy
 */
public interface TaskSelectionStrategy {

  /**
   * Returns the index of the task to run.
   *
   * @param pending non-empty list of pending tasks in enqueue order
   * @param now current time, identical for every task in this scan
   * @return index into {@code pending}
   */
  int select(List<Task> pending, Instant now);

  /**
   * Returns strategy name for logging.
   *
   * @return strategy name (e.g. "aging-priority")
   */
  String getName();
}
