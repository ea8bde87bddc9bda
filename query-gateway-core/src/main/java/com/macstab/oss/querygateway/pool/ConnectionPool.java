/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.pool;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.querygateway.engine.QueryEngine;
import com.macstab.oss.querygateway.metrics.QueryGatewayMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size pool of database sessions lent exclusively to dispatcher workers.
 *
 * <p><strong>Size invariant:</strong> {@code size} slots are opened in the constructor and never
 * grow or shrink. A slot whose session dies is repaired in place (see {@link
 * #releaseAfterFailure(PooledConnection)}), never dropped.
 *
 * <p><strong>Blocking hand-off:</strong> Idle slots live in a fair {@link ArrayBlockingQueue}.
 * {@link #acquire()} parks the calling worker until a slot is returned; {@link
 * #release(PooledConnection)} wakes exactly one parked acquirer (longest waiting first, fairness
 * flag). The queue's internal lock is the pool's only mutex and is never held across query I/O.
 *
 * <p><strong>Exclusive ownership:</strong> Each slot carries a CAS-guarded borrowed flag. A slot
 * handed out twice, or returned twice, throws {@link IllegalStateException} instead of silently
 * sharing a session.
 *
 * <p>With pool size equal to the dispatcher worker count every worker holds at most one slot, so
 * under steady load the idle queue is empty and acquisition never blocks for long. Under sustained
 * overload a worker blocks indefinitely in {@link #acquire()} rather than failing fast.
 */
@Slf4j
public final class ConnectionPool {

  private final QueryEngine engine;
  @Getter private final int size;
  @Getter private final String poolName;
  final PooledConnection[] slots; // Package-private for testing
  private final BlockingQueue<PooledConnection> idle;
  private final QueryGatewayMetrics metrics;
  private volatile boolean destroyed;

  public ConnectionPool(@NonNull final QueryEngine engine, final int size) {
    this(engine, size, QueryGatewayMetrics.NOOP, "default");
  }

  /**
   * Creates the pool and opens all sessions.
   *
   * @param engine session factory (must not be null)
   * @param size number of slots (must be &gt;= 1)
   * @param metrics metrics collector
   * @param poolName pool name for logs and dimensional metrics
   * @throws IllegalStateException if any session cannot be opened (all opened ones are closed)
   */
  public ConnectionPool(
      @NonNull final QueryEngine engine,
      final int size,
      @NonNull final QueryGatewayMetrics metrics,
      @NonNull final String poolName) {

    if (size < 1) {
      throw new IllegalArgumentException("Pool size must be >= 1, got: " + size);
    }

    this.engine = engine;
    this.size = size;
    this.poolName = poolName;
    this.metrics = metrics;
    this.slots = new PooledConnection[size];
    this.idle = new ArrayBlockingQueue<>(size, true);
    this.destroyed = false;

    initializeSlots();

    if (log.isInfoEnabled()) {
      log.info("Created ConnectionPool '{}' with {} connections", poolName, size);
    }
  }

  /**
   * Borrows a connection, blocking until one is idle.
   *
   * @return exclusively owned connection; must be handed back via {@link #release}
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the pool has been destroyed
   */
  public PooledConnection acquire() throws InterruptedException {
    checkNotDestroyed();
    return lend(idle.take());
  }

  /**
   * Borrows a connection, waiting at most {@code timeout}.
   *
   * @param timeout maximum wait
   * @return the connection, or empty if none became idle in time
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<PooledConnection> tryAcquire(@NonNull final Duration timeout)
      throws InterruptedException {
    checkNotDestroyed();
    final var connection = idle.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    return connection == null ? Optional.empty() : Optional.of(lend(connection));
  }

  /**
   * Returns a borrowed connection and wakes one blocked acquirer.
   *
   * @param connection connection previously obtained from this pool
   * @throws IllegalArgumentException if the connection belongs to another pool
   * @throws IllegalStateException if the connection is not currently borrowed
   */
  public void release(@NonNull final PooledConnection connection) {
    checkOwned(connection);
    connection.markReturned();
    if (destroyed) {
      connection.close();
      return;
    }
    idle.add(connection);
    if (destroyed && idle.remove(connection)) {
      // destroy() drained the queue between the check above and the add
      connection.close();
      return;
    }
    metrics.setConnectionsInUse(poolName, getInUseCount());
  }

  /**
   * Returns a connection whose last execution failed, replacing its session if it is no longer
   * valid.
   *
   * <p>A valid session goes back unchanged. An invalid one is closed and a fresh session is opened
   * into the same slot. If opening the replacement fails, the old handle is returned as-is and the
   * repair is retried after its next failure; the slot count never changes.
   *
   * @param connection connection previously obtained from this pool
   */
  public void releaseAfterFailure(@NonNull final PooledConnection connection) {
    checkOwned(connection);
    if (!destroyed && !isSessionValid(connection)) {
      replaceSession(connection);
    }
    release(connection);
  }

  public int getIdleCount() {
    return idle.size();
  }

  public int getInUseCount() {
    int count = 0;
    for (final var slot : slots) {
      if (slot != null && slot.isBorrowed()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Closes all idle sessions. Borrowed connections are closed when they are released.
   *
   * <p>Idempotent.
   */
  public void destroy() {
    if (destroyed) {
      return;
    }

    destroyed = true;

    try {
      PooledConnection connection;
      while ((connection = idle.poll()) != null) {
        connection.close();
      }
      if (log.isInfoEnabled()) {
        log.info("Destroyed ConnectionPool '{}'", poolName);
      }
    } catch (final RuntimeException e) {
      log.error("Error during ConnectionPool destruction", e);
    }
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  // ==================== Private Methods ====================

  private PooledConnection lend(final PooledConnection connection) {
    connection.markBorrowed();
    metrics.setConnectionsInUse(poolName, getInUseCount());
    return connection;
  }

  private void checkNotDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("ConnectionPool '" + poolName + "' has been destroyed");
    }
  }

  private void checkOwned(final PooledConnection connection) {
    final int index = connection.getIndex();
    if (index >= slots.length || slots[index] != connection) {
      throw new IllegalArgumentException(
          "Connection " + connection + " does not belong to pool '" + poolName + "'");
    }
  }

  private boolean isSessionValid(final PooledConnection connection) {
    try {
      return connection.isValid();
    } catch (final RuntimeException e) {
      log.warn("Validity probe failed for {}", connection, e);
      return false;
    }
  }

  private void replaceSession(final PooledConnection connection) {
    try {
      final var previous = connection.replaceSession(engine.openSession());
      previous.close();
      metrics.recordConnectionReplaced(poolName, connection.getIndex());
      log.warn("Replaced invalid session in {}", connection);
    } catch (final RuntimeException e) {
      log.error("Could not replace invalid session in {}; keeping old handle", connection, e);
    }
  }

  private void initializeSlots() {
    try {
      for (int i = 0; i < size; i++) {
        slots[i] = new PooledConnection(i, engine.openSession(), poolName);
        idle.add(slots[i]);
      }
    } catch (final RuntimeException ex) {
      closeSlots();
      throw new IllegalStateException(
          "Failed to initialize connection pool '" + poolName + "'", ex);
    }
  }

  private void closeSlots() {
    for (final var slot : slots) {
      if (slot != null) {
        slot.close();
      }
    }
  }
}
