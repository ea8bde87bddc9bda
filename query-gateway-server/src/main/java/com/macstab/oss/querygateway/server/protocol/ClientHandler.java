/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.macstab.oss.querygateway.report.MaintenanceService;
import com.macstab.oss.querygateway.scheduler.Task;
import com.macstab.oss.querygateway.scheduler.TaskQueue;
import com.macstab.oss.querygateway.util.Jsons;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Serves one client connection on its own thread.
 *
 * <p><strong>Handshake:</strong> bytes up to the first newline (at most {@code handshakeMaxBytes})
 * carry an ASCII priority. Anything that is not a plain non-negative integer means priority 1;
 * values above 9 are capped at 9. Bytes after the newline belong to the first query.
 *
 * <p><strong>Streaming (1..9):</strong> each receive call of up to {@code receiveBufferBytes} is
 * one query. Whitespace-only payloads are skipped. Every query becomes a {@link Task}; replies are
 * written later by the dispatcher worker that runs it, not by this thread.
 *
 * <p><strong>Maintenance (0):</strong> receives a JSON array of client latencies, runs one
 * maintenance cycle and closes. A payload that is not such an array counts as an empty list.
 *
 * <p><strong>Close:</strong> on EOF or an I/O error. Tasks already queued from this connection are
 * not cancelled; their replies are dropped.
 */
@Slf4j
public final class ClientHandler implements Runnable {

  private static final TypeReference<List<Double>> LATENCIES = new TypeReference<>() {};

  @Getter private final String clientId;
  private final Socket socket;
  private final TaskQueue queue;
  private final MaintenanceService maintenance;
  private final ProtocolSettings settings;
  private final Clock clock;
  @Getter private volatile ProtocolState state = ProtocolState.HANDSHAKE;

  public ClientHandler(
      @NonNull final String clientId,
      @NonNull final Socket socket,
      @NonNull final TaskQueue queue,
      @NonNull final MaintenanceService maintenance,
      @NonNull final ProtocolSettings settings,
      @NonNull final Clock clock) {
    this.clientId = clientId;
    this.socket = socket;
    this.queue = queue;
    this.maintenance = maintenance;
    this.settings = settings;
    this.clock = clock;
  }

  @Override
  public void run() {
    SocketReplyChannel replies = null;
    try (socket) {
      final var in = socket.getInputStream();
      final int priority = parsePriority(readHandshake(in));
      if (log.isInfoEnabled()) {
        log.info(
            "Client {} connected from {} with priority {}",
            clientId, socket.getRemoteSocketAddress(), priority);
      }

      if (priority == 0) {
        state = ProtocolState.MAINTENANCE;
        maintenance.runMaintenance(readLatencies(in));
        return;
      }

      state = ProtocolState.STREAMING;
      replies = new SocketReplyChannel(clientId, socket.getOutputStream());
      stream(in, replies, priority);
    } catch (final IOException e) {
      log.debug("Client {} connection error: {}", clientId, e.getMessage());
    } catch (final RuntimeException e) {
      log.error("Client {} handler failed in state {}", clientId, state, e);
    } finally {
      if (replies != null) {
        replies.markClosed();
      }
      state = ProtocolState.CLOSED;
      log.info("Client {} disconnected", clientId);
    }
  }

  /**
   * Maps a handshake line to a priority.
   *
   * @param raw handshake text, possibly with surrounding whitespace
   * @return 0 for maintenance, otherwise 1 to 9
   */
  static int parsePriority(final String raw) {
    final String text = raw == null ? "" : raw.strip();
    if (text.isEmpty() || !text.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
      return Task.MIN_PRIORITY;
    }
    try {
      return Math.min(Integer.parseInt(text), Task.MAX_PRIORITY);
    } catch (final NumberFormatException e) {
      // Digits only, so the value overflowed int
      return Task.MAX_PRIORITY;
    }
  }

  /**
   * Parses a maintenance payload.
   *
   * @param json payload received so far
   * @return latencies, empty if the JSON is incomplete
   * @throws JsonProcessingException if the payload is complete but not a number array
   */
  static Optional<List<Double>> parseLatencies(final String json) throws JsonProcessingException {
    if (json.isBlank()) {
      return Optional.empty();
    }
    try {
      final List<Double> latencies = Jsons.mapper().readValue(json, LATENCIES);
      if (latencies == null) {
        return Optional.of(List.of());
      }
      return Optional.of(latencies.stream().filter(Objects::nonNull).toList());
    } catch (final JsonEOFException e) {
      return Optional.empty();
    }
  }

  // ==================== Private Methods ====================

  private String readHandshake(final InputStream in) throws IOException {
    final var line = new ByteArrayOutputStream(settings.handshakeMaxBytes());
    for (int i = 0; i < settings.handshakeMaxBytes(); i++) {
      final int b = in.read();
      if (b < 0 || b == '\n') {
        break;
      }
      line.write(b);
    }
    return line.toString(StandardCharsets.UTF_8);
  }

  private void stream(final InputStream in, final SocketReplyChannel replies, final int priority)
      throws IOException {
    final byte[] buffer = new byte[settings.receiveBufferBytes()];
    int read;
    while ((read = in.read(buffer)) >= 0) {
      final String query = new String(buffer, 0, read, StandardCharsets.UTF_8).strip();
      if (query.isEmpty()) {
        continue;
      }
      queue.enqueue(new Task(replies, clientId, priority, clock.instant(), query));
    }
  }

  private List<Double> readLatencies(final InputStream in) throws IOException {
    final byte[] buffer = new byte[settings.maintenanceBufferBytes()];
    final var payload = new ByteArrayOutputStream();
    final int maxBytes = settings.maintenanceBufferBytes() * ProtocolSettings.MAINTENANCE_READS_MAX;
    try {
      int read;
      while ((read = in.read(buffer)) >= 0) {
        payload.write(buffer, 0, read);
        final var parsed = parseLatencies(payload.toString(StandardCharsets.UTF_8));
        if (parsed.isPresent()) {
          return parsed.get();
        }
        if (payload.size() >= maxBytes) {
          break;
        }
      }
      log.warn("Client {} sent an incomplete maintenance payload; using no latencies", clientId);
    } catch (final JsonProcessingException e) {
      log.warn(
          "Client {} sent a malformed maintenance payload; using no latencies: {}",
          clientId,
          e.getOriginalMessage());
    }
    return List.of();
  }
}
