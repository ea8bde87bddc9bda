/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.engine;

/**
 * Generic execution failure of the backing query engine.
 *
 * <p>Engine-specific errors ({@code SQLException}, driver exceptions) are wrapped into this type so
 * the dispatcher handles every engine fault the same way: log, reply an error payload, keep the
 * worker running.
 */
public class QueryExecutionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public QueryExecutionException(final String message) {
    super(message);
  }

  public QueryExecutionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
