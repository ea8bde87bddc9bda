/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToLongFunction;

import com.macstab.oss.querygateway.engine.QueryEngine;
import com.macstab.oss.querygateway.engine.QueryExecutionException;
import com.macstab.oss.querygateway.engine.QueryRows;
import com.macstab.oss.querygateway.engine.QuerySession;

/**
 * In-memory engine for tests.
 *
 * <p>Row count comes from {@code rowCounter}; a query containing {@code FAIL} throws. Every opened
 * session is kept so tests can inspect executions, validity and closing.
 */
public final class StubQueryEngine implements QueryEngine {

  private final ToLongFunction<String> rowCounter;
  private final List<StubSession> sessions = new ArrayList<>();
  private final AtomicInteger executions = new AtomicInteger();
  private volatile boolean failOpen;

  public StubQueryEngine() {
    this(sql -> 1L);
  }

  public StubQueryEngine(final ToLongFunction<String> rowCounter) {
    this.rowCounter = rowCounter;
  }

  @Override
  public synchronized QuerySession openSession() {
    if (failOpen) {
      throw new QueryExecutionException("database unreachable");
    }
    final var session = new StubSession();
    sessions.add(session);
    return session;
  }

  public void setFailOpen(final boolean failOpen) {
    this.failOpen = failOpen;
  }

  public synchronized List<StubSession> getSessions() {
    return List.copyOf(sessions);
  }

  public int getExecutions() {
    return executions.get();
  }

  /** Session double. */
  public final class StubSession implements QuerySession {

    private volatile boolean valid = true;
    private volatile boolean closed;

    @Override
    public QueryRows execute(final String sql) {
      executions.incrementAndGet();
      if (sql.contains("FAIL")) {
        throw new QueryExecutionException("syntax error near FAIL");
      }
      return new QueryRows(rowCounter.applyAsLong(sql));
    }

    @Override
    public boolean isValid() {
      return valid && !closed;
    }

    @Override
    public void close() {
      closed = true;
    }

    public void invalidate() {
      valid = false;
    }

    public boolean isClosed() {
      return closed;
    }
  }
}
