/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.macstab.oss.querygateway.model.QueryOutcome;
import com.macstab.oss.querygateway.scheduler.ReplyChannel;
import com.macstab.oss.querygateway.util.Jsons;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes newline-terminated JSON replies to a client socket.
 *
 * <p>Writes are serialized on this channel: two workers finishing tasks of the same client never
 * interleave bytes. A write to a vanished peer is dropped after a debug log; the task that produced
 * it is already complete.
 */
@Slf4j
final class SocketReplyChannel implements ReplyChannel {

  private final String clientId;
  private final OutputStream out;
  private volatile boolean open = true;

  SocketReplyChannel(final String clientId, final OutputStream out) {
    this.clientId = clientId;
    this.out = out;
  }

  @Override
  public void reply(final QueryOutcome outcome) {
    write(Jsons.toJson(outcome));
  }

  @Override
  public void replyError(final String message) {
    write(Jsons.toJson(Map.of("error", message)));
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  void markClosed() {
    open = false;
  }

  private synchronized void write(final String json) {
    if (!open) {
      log.debug("Dropping reply to disconnected client {}", clientId);
      return;
    }
    try {
      out.write((json + "\n").getBytes(StandardCharsets.UTF_8));
      out.flush();
    } catch (final IOException e) {
      open = false;
      log.debug("Reply to client {} failed: {}", clientId, e.getMessage());
    }
  }
}
