/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.scheduler;

import java.time.Instant;

import lombok.NonNull;

/**
 * Pending query, immutable from creation to execution.
 *
 * @param replyTo connection the reply goes to
 * @param clientId opaque id, unique per client connection
 * @param priority declared priority, 1 to 9
 * @param enqueuedAt time the handler read the query
 * @param query opaque query text
 */
public record Task(
    @NonNull ReplyChannel replyTo,
    @NonNull String clientId,
    int priority,
    @NonNull Instant enqueuedAt,
    @NonNull String query) {

  public static final int MIN_PRIORITY = 1;
  public static final int MAX_PRIORITY = 9;

  public Task {
    if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
      throw new IllegalArgumentException(
          "priority must be in [" + MIN_PRIORITY + ", " + MAX_PRIORITY + "], got: " + priority);
    }
  }
}
