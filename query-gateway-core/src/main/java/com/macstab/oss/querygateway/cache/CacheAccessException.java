/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

/** Failure of a cache backend call (connection refused, timeout, protocol error). */
public class CacheAccessException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public CacheAccessException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
