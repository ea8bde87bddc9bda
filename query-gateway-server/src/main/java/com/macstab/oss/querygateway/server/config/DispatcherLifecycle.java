/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.config;

import java.time.Duration;

import org.springframework.context.SmartLifecycle;

import com.macstab.oss.querygateway.dispatch.DispatcherPool;

import lombok.NonNull;

/**
 * Ties the {@link DispatcherPool} to the application context.
 *
 * <p>Phase 0: workers are running before the listener accepts the first client, and keep running
 * until the listener has stopped, then get {@code shutdownGrace} for tasks in flight.
 */
public final class DispatcherLifecycle implements SmartLifecycle {

  private final DispatcherPool dispatcher;
  private final Duration shutdownGrace;

  public DispatcherLifecycle(
      @NonNull final DispatcherPool dispatcher, @NonNull final Duration shutdownGrace) {
    this.dispatcher = dispatcher;
    this.shutdownGrace = shutdownGrace;
  }

  @Override
  public void start() {
    dispatcher.start();
  }

  @Override
  public void stop() {
    dispatcher.stop(shutdownGrace);
  }

  @Override
  public boolean isRunning() {
    return dispatcher.isRunning();
  }

  @Override
  public int getPhase() {
    return 0;
  }
}
