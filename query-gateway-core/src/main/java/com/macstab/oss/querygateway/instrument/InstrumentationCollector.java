/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.instrument;

import java.util.concurrent.Callable;

/**
 * Wraps a call with latency and resource-usage sampling.
 *
 * <p>Implementations MUST be thread-safe: every dispatcher worker measures its own query
 * concurrently.
 */
@FunctionalInterface
public interface InstrumentationCollector {

  /**
   * Runs {@code call} and measures it.
   *
   * @param call the work to measure
   * @param <T> result type
   * @return result with its measured usage
   * @throws Exception whatever {@code call} throws, unchanged
   */
  <T> Measurement<T> measure(Callable<T> call) throws Exception;
}
