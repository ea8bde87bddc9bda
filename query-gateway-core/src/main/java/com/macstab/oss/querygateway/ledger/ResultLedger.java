/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.querygateway.model.QueryOutcome;

import lombok.NonNull;

/**
 * Completed outcomes since the last maintenance cycle, in completion order.
 *
 * <p>Shared by every dispatcher worker (append) and the maintenance handler (drain). {@link
 * #drain()} takes the snapshot and clears in one critical section, so an outcome appended
 * concurrently lands either in the drained batch or in the next one, never in neither.
 */
public final class ResultLedger {

  private final ReentrantLock lock = new ReentrantLock();
  private List<QueryOutcome> outcomes = new ArrayList<>();

  public void append(@NonNull final QueryOutcome outcome) {
    lock.lock();
    try {
      outcomes.add(outcome);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Atomically removes and returns everything recorded so far.
   *
   * @return recorded outcomes in completion order (possibly empty, never null)
   */
  public List<QueryOutcome> drain() {
    lock.lock();
    try {
      final var drained = outcomes;
      outcomes = new ArrayList<>();
      return List.copyOf(drained);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return outcomes.size();
    } finally {
      lock.unlock();
    }
  }
}
