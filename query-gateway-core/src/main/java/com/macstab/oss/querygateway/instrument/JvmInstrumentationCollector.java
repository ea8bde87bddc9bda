/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.instrument;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.querygateway.model.PhaseMetrics;
import com.macstab.oss.querygateway.model.ResourceUsage;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Samples this JVM process around a call in three phases.
 *
 * <ol>
 *   <li><strong>pre:</strong> one snapshot, then the network rate over {@code rateWindow}
 *   <li><strong>during:</strong> a sampler runs every {@code sampleInterval} while the call runs;
 *       the phase value is the mean of its samples (the pre snapshot if the call finished before
 *       the first tick)
 *   <li><strong>post:</strong> after {@code settleDelay}, one snapshot and the network rate over
 *       {@code rateWindow}
 * </ol>
 *
 * <p>Only the call itself counts towards the reported latency. The pre and post windows run on the
 * calling thread, so a measured call occupies its worker for roughly {@code 2 × rateWindow +
 * settleDelay} longer than the query.
 *
 * <p>Readings are process-wide, so concurrent measurements see each other's load.
 */
@Slf4j
public final class JvmInstrumentationCollector implements InstrumentationCollector, AutoCloseable {

  private record Snapshot(
      double cpu, double memoryMb, double threads, double fds, double netKbps) {}

  private final ProcessProbe probe;
  private final Duration sampleInterval;
  private final Duration rateWindow;
  private final Duration settleDelay;
  private final ScheduledExecutorService sampler;

  public JvmInstrumentationCollector(
      @NonNull final Duration sampleInterval,
      @NonNull final Duration rateWindow,
      @NonNull final Duration settleDelay) {
    this(new ProcessProbe(), sampleInterval, rateWindow, settleDelay);
  }

  JvmInstrumentationCollector(
      final ProcessProbe probe,
      final Duration sampleInterval,
      final Duration rateWindow,
      final Duration settleDelay) {
    if (sampleInterval.isZero() || sampleInterval.isNegative()) {
      throw new IllegalArgumentException("sampleInterval must be positive, got: " + sampleInterval);
    }
    if (rateWindow.isNegative() || settleDelay.isNegative()) {
      throw new IllegalArgumentException("rateWindow and settleDelay must not be negative");
    }
    this.probe = probe;
    this.sampleInterval = sampleInterval;
    this.rateWindow = rateWindow;
    this.settleDelay = settleDelay;
    this.sampler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              final var thread = new Thread(runnable, "querygate-usage-sampler");
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public <T> Measurement<T> measure(@NonNull final Callable<T> call) throws Exception {
    final var pre = snapshot(rateOver(rateWindow));

    final List<Snapshot> samples = new ArrayList<>();
    final long[] lastBytes = {probe.networkBytes()};
    final long[] lastTick = {System.nanoTime()};
    final var ticker =
        sampler.scheduleAtFixedRate(
            () -> {
              final long bytes = probe.networkBytes();
              final long tick = System.nanoTime();
              final double kbps = kbps(bytes - lastBytes[0], tick - lastTick[0]);
              lastBytes[0] = bytes;
              lastTick[0] = tick;
              final var sample = snapshot(kbps);
              synchronized (samples) {
                samples.add(sample);
              }
            },
            sampleInterval.toNanos(),
            sampleInterval.toNanos(),
            TimeUnit.NANOSECONDS);

    final T result;
    final long started = System.nanoTime();
    try {
      result = call.call();
    } finally {
      ticker.cancel(false);
    }
    final double latencySeconds = (System.nanoTime() - started) / 1_000_000_000.0;

    final Snapshot during;
    synchronized (samples) {
      during = samples.isEmpty() ? pre : mean(samples);
    }

    sleep(settleDelay);
    final var post = snapshot(rateOver(rateWindow));

    return new Measurement<>(result, toUsage(pre, during, post), latencySeconds);
  }

  @Override
  public void close() {
    sampler.shutdownNow();
  }

  // ==================== Private Methods ====================

  private Snapshot snapshot(final double netKbps) {
    return new Snapshot(
        probe.cpuPercent(),
        probe.memoryMb(),
        probe.threadCount(),
        probe.openFileDescriptors(),
        netKbps);
  }

  private double rateOver(final Duration window) throws InterruptedException {
    final long before = probe.networkBytes();
    final long started = System.nanoTime();
    sleep(window);
    return kbps(probe.networkBytes() - before, System.nanoTime() - started);
  }

  private static double kbps(final long bytes, final long nanos) {
    if (nanos <= 0L || bytes <= 0L) {
      return 0.0;
    }
    return (bytes / 1024.0) / (nanos / 1_000_000_000.0);
  }

  private static void sleep(final Duration duration) throws InterruptedException {
    if (!duration.isZero()) {
      TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
  }

  private static Snapshot mean(final List<Snapshot> samples) {
    double cpu = 0;
    double memory = 0;
    double threads = 0;
    double fds = 0;
    double net = 0;
    for (final var sample : samples) {
      cpu += sample.cpu();
      memory += sample.memoryMb();
      threads += sample.threads();
      fds += sample.fds();
      net += sample.netKbps();
    }
    final int n = samples.size();
    return new Snapshot(cpu / n, memory / n, threads / n, fds / n, net / n);
  }

  private static ResourceUsage toUsage(
      final Snapshot pre, final Snapshot during, final Snapshot post) {
    return new ResourceUsage(
        new PhaseMetrics(pre.cpu(), during.cpu(), post.cpu()),
        new PhaseMetrics(pre.memoryMb(), during.memoryMb(), post.memoryMb()),
        new PhaseMetrics(pre.threads(), during.threads(), post.threads()),
        new PhaseMetrics(pre.fds(), during.fds(), post.fds()),
        new PhaseMetrics(pre.netKbps(), during.netKbps(), post.netKbps()));
  }
}
