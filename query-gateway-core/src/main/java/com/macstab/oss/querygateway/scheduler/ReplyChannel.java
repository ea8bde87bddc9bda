/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.scheduler;

import com.macstab.oss.querygateway.model.QueryOutcome;

/**
 * Write side of the client connection a task came from.
 *
 * <p>Replies are delivered by whichever dispatcher worker executes the task, so implementations
 * MUST be thread-safe. A reply to a peer that has already disconnected is dropped silently.
 */
public interface ReplyChannel {

  void reply(QueryOutcome outcome);

  void replyError(String message);

  /** {@code false} once the peer is known to be gone. */
  default boolean isOpen() {
    return true;
  }
}
