/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.instrument;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.sun.management.OperatingSystemMXBean;
import com.sun.management.UnixOperatingSystemMXBean;

import lombok.extern.slf4j.Slf4j;

/**
 * Point-in-time readings of this process.
 *
 * <p>Linux {@code /proc} files are preferred where they exist (resident memory, network bytes);
 * elsewhere the JVM's management beans stand in, or the reading is 0.
 */
@Slf4j
class ProcessProbe {

  private static final Path PROC_STATUS = Path.of("/proc/self/status");
  private static final Path PROC_NET_DEV = Path.of("/proc/net/dev");

  private final java.lang.management.OperatingSystemMXBean os =
      ManagementFactory.getOperatingSystemMXBean();
  private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();

  /** Process CPU load in percent, 0 when unavailable. */
  double cpuPercent() {
    if (os instanceof OperatingSystemMXBean sunOs) {
      final double load = sunOs.getProcessCpuLoad();
      return load < 0 ? 0.0 : load * 100.0;
    }
    return 0.0;
  }

  /** Resident set size in MiB; falls back to JVM heap in use. */
  double memoryMb() {
    if (Files.isReadable(PROC_STATUS)) {
      try {
        for (final String line : Files.readAllLines(PROC_STATUS)) {
          if (line.startsWith("VmRSS:")) {
            final String[] parts = line.trim().split("\\s+");
            return Long.parseLong(parts[1]) / 1024.0;
          }
        }
      } catch (final IOException | RuntimeException e) {
        log.debug("Could not read {}: {}", PROC_STATUS, e.getMessage());
      }
    }
    final var runtime = Runtime.getRuntime();
    return (runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0);
  }

  int threadCount() {
    return threads.getThreadCount();
  }

  /** Open file descriptors, 0 on platforms without the Unix bean. */
  long openFileDescriptors() {
    if (os instanceof UnixOperatingSystemMXBean unixOs) {
      return unixOs.getOpenFileDescriptorCount();
    }
    return 0L;
  }

  /** Received plus sent bytes over all interfaces, 0 when {@code /proc/net/dev} is absent. */
  long networkBytes() {
    if (!Files.isReadable(PROC_NET_DEV)) {
      return 0L;
    }
    try {
      return sumNetDev(Files.readAllLines(PROC_NET_DEV));
    } catch (final IOException e) {
      log.debug("Could not read {}: {}", PROC_NET_DEV, e.getMessage());
      return 0L;
    }
  }

  /**
   * Sums the receive and transmit byte columns of {@code /proc/net/dev} lines.
   *
   * @param lines file content; the two header lines are skipped
   * @return total bytes
   */
  static long sumNetDev(final List<String> lines) {
    long total = 0L;
    for (int i = 2; i < lines.size(); i++) {
      final String line = lines.get(i);
      final int colon = line.indexOf(':');
      if (colon < 0) {
        continue;
      }
      final String[] fields = line.substring(colon + 1).trim().split("\\s+");
      if (fields.length >= 9) {
        total += Long.parseLong(fields[0]) + Long.parseLong(fields[8]);
      }
    }
    return total;
  }
}
