/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.pool;

import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.querygateway.engine.QueryRows;
import com.macstab.oss.querygateway.engine.QuerySession;

import lombok.Getter;
import lombok.NonNull;

/**
 * Single pool slot wrapping one database session.
 *
 * <p><strong>Ownership:</strong> Exactly one party owns a slot at any time: the {@link
 * ConnectionPool} while idle, or the dispatcher worker that borrowed it. {@code borrowed} is the
 * guard: {@link #markBorrowed()} and {@link #markReturned()} are CAS transitions, so a second
 * borrow of a lent slot (or a double return) fails loudly instead of sharing a session between two
 * workers.
 *
 * <p><strong>Session replacement:</strong> {@code session} is {@code volatile} because the pool may
 * swap it (replace-on-failure) while the slot is held by the pool. The swap happens only between a
 * return and the next borrow, and the pool's {@code BlockingQueue} hand-off publishes it to the
 * next borrower.
 *
 * @see ConnectionPool
 */
public final class PooledConnection {

  @Getter private final int index;
  @Getter private final String poolName;
  private final AtomicBoolean borrowed;
  private volatile QuerySession session;

  PooledConnection(
      final int index, @NonNull final QuerySession session, @NonNull final String poolName) {
    if (index < 0) {
      throw new IllegalArgumentException("Slot index must be >= 0, got: " + index);
    }
    this.index = index;
    this.session = session;
    this.poolName = poolName;
    this.borrowed = new AtomicBoolean(false);
  }

  /**
   * Runs a query on this slot's session.
   *
   * @param sql query text
   * @return result shape
   * @throws IllegalStateException if the slot is not currently borrowed
   */
  public QueryRows execute(final String sql) {
    if (!borrowed.get()) {
      throw new IllegalStateException("Connection " + this + " used while not borrowed");
    }
    return session.execute(sql);
  }

  public boolean isBorrowed() {
    return borrowed.get();
  }

  boolean isValid() {
    return session.isValid();
  }

  void markBorrowed() {
    if (!borrowed.compareAndSet(false, true)) {
      throw new IllegalStateException("Connection " + this + " is already borrowed");
    }
  }

  void markReturned() {
    if (!borrowed.compareAndSet(true, false)) {
      throw new IllegalStateException("Connection " + this + " was not borrowed");
    }
  }

  /** Swaps in a fresh session; returns the old one for the caller to close. */
  QuerySession replaceSession(@NonNull final QuerySession replacement) {
    final var previous = session;
    session = replacement;
    return previous;
  }

  void close() {
    session.close();
  }

  @Override
  public String toString() {
    return String.format("Connection[%s#%d, borrowed=%s]", poolName, index, borrowed.get());
  }
}
