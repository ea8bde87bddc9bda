/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.SmartLifecycle;

import com.macstab.oss.querygateway.report.MaintenanceService;
import com.macstab.oss.querygateway.scheduler.TaskQueue;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts client connections and gives each its own {@link ClientHandler} thread.
 *
 * <p><strong>Threads:</strong> one acceptor thread plus one handler thread per open connection.
 * Handler threads are unbounded in number and spend their time blocked in receive calls.
 *
 * <p><strong>Lifecycle:</strong> starts after the dispatcher and stops before it. Stopping closes
 * only the server socket, so tasks finishing in the dispatcher's grace period can still reply.
 * {@link #close()} then closes the remaining client sockets, which ends their handler threads.
 *
 * <p>A bind failure surfaces from {@link #start()} and fails application startup.
 */
@Slf4j
public final class ConnectionListener implements SmartLifecycle, Closeable {

  /** Starts after, and stops before, the dispatcher lifecycle (phase 0). */
  public static final int PHASE = 100;

  private static final int BACKLOG = 100;

  private final String host;
  private final int port;
  private final TaskQueue queue;
  private final MaintenanceService maintenance;
  private final ProtocolSettings settings;
  private final Clock clock;
  private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
  private final AtomicInteger handlerCount = new AtomicInteger();

  private volatile ServerSocket serverSocket;
  private volatile boolean running;

  public ConnectionListener(
      @NonNull final String host,
      final int port,
      @NonNull final TaskQueue queue,
      @NonNull final MaintenanceService maintenance,
      @NonNull final ProtocolSettings settings,
      @NonNull final Clock clock) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be in [0, 65535], got: " + port);
    }
    this.host = host;
    this.port = port;
    this.queue = queue;
    this.maintenance = maintenance;
    this.settings = settings;
    this.clock = clock;
  }

  @Override
  public void start() {
    if (running) {
      return;
    }
    try {
      final var socket = new ServerSocket();
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(host, port), BACKLOG);
      serverSocket = socket;
    } catch (final IOException e) {
      throw new IllegalStateException("Cannot bind query gateway to " + host + ":" + port, e);
    }
    running = true;

    final var acceptor = new Thread(this::acceptLoop, "querygate-acceptor");
    acceptor.setDaemon(true);
    acceptor.start();

    if (log.isInfoEnabled()) {
      log.info("Query gateway listening on {}:{}", host, getLocalPort());
    }
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    running = false;
    closeQuietly(serverSocket);
    log.info("Query gateway listener stopped");
  }

  /** Stops accepting if still running and closes every open client connection. Idempotent. */
  @Override
  public void close() {
    stop();
    final int open = clients.size();
    clients.forEach(ConnectionListener::closeQuietly);
    clients.clear();
    if (open > 0 && log.isInfoEnabled()) {
      log.info("Closed {} client connections", open);
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }

  /** Bound port, useful when configured with port 0; -1 before start. */
  public int getLocalPort() {
    final var socket = serverSocket;
    return socket == null ? -1 : socket.getLocalPort();
  }

  /** Currently open client connections. */
  public int getOpenConnections() {
    return clients.size();
  }

  // ==================== Private Methods ====================

  private void acceptLoop() {
    while (running) {
      final Socket client;
      try {
        client = serverSocket.accept();
      } catch (final SocketException e) {
        if (running) {
          log.error("Accept failed, listener stopping", e);
          running = false;
        }
        return;
      } catch (final IOException e) {
        log.warn("Accept failed: {}", e.getMessage());
        continue;
      }
      spawnHandler(client);
    }
  }

  private void spawnHandler(final Socket client) {
    clients.add(client);
    final var handler =
        new ClientHandler(
            UUID.randomUUID().toString(), client, queue, maintenance, settings, clock);
    final var thread =
        new Thread(
            () -> {
              try {
                handler.run();
              } finally {
                clients.remove(client);
              }
            },
            "querygate-client-" + handlerCount.incrementAndGet());
    thread.setDaemon(true);
    thread.start();
  }

  private static void closeQuietly(final Closeable closeable) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (final IOException e) {
      log.debug("Close failed: {}", e.getMessage());
    }
  }
}
