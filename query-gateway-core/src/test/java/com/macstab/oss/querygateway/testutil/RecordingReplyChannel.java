/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.testutil;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.scheduler.ReplyChannel;

/** Collects replies in arrival order. */
public final class RecordingReplyChannel implements ReplyChannel {

  private final List<QueryOutcome> outcomes = new CopyOnWriteArrayList<>();
  private final List<String> errors = new CopyOnWriteArrayList<>();
  private volatile boolean open = true;

  @Override
  public void reply(final QueryOutcome outcome) {
    outcomes.add(outcome);
  }

  @Override
  public void replyError(final String message) {
    errors.add(message);
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  public void disconnect() {
    open = false;
  }

  public List<QueryOutcome> getOutcomes() {
    return outcomes;
  }

  public List<String> getErrors() {
    return errors;
  }
}
