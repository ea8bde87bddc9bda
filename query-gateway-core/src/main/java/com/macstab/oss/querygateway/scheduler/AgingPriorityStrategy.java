/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Priority with aging: {@code score = priority × secondsWaited}.
 *
 * <p><strong>Starvation freedom:</strong> A task's score grows linearly with its wait, so any
 * priority-1 task left long enough outscores a freshly queued priority-9 task (whose score starts
 * at 0).
 *
 * <p><strong>Tie-break:</strong> Highest score wins. On equal score the higher declared priority
 * wins; on equal priority the earliest-enqueued task wins (first maximum in enqueue order). The
 * priority step matters for tasks enqueued at the same instant, whose scores are all 0.
 *
 * <p><strong>Cost:</strong> O(n) full scan per selection. Fine for shallow queues; deep queues
 * would want a periodically re-scored heap.
 */
public final class AgingPriorityStrategy implements TaskSelectionStrategy {

  @Override
  public int select(final List<Task> pending, final Instant now) {
    if (pending.isEmpty()) {
      throw new IllegalArgumentException("No pending tasks to select from");
    }
    int best = 0;
    double bestScore = score(pending.get(0), now);
    for (int i = 1; i < pending.size(); i++) {
      final var candidate = pending.get(i);
      final double candidateScore = score(candidate, now);
      if (candidateScore > bestScore
          || (candidateScore == bestScore && candidate.priority() > pending.get(best).priority())) {
        best = i;
        bestScore = candidateScore;
      }
    }
    return best;
  }

  /**
   * Aging score of a task at {@code now}. Negative waits (clock skew) count as zero.
   *
   * @param task task to score
   * @param now evaluation time
   * @return {@code priority × seconds waited}
   */
  public static double score(final Task task, final Instant now) {
    final var waited = Duration.between(task.enqueuedAt(), now);
    final double seconds = waited.isNegative() ? 0.0 : waited.toNanos() / 1_000_000_000.0;
    return task.priority() * seconds;
  }

  @Override
  public String getName() {
    return "aging-priority";
  }
}
