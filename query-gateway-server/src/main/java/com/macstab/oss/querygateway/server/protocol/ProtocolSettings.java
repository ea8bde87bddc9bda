/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

/**
 * Receive sizes of the wire protocol.
 *
 * @param handshakeMaxBytes longest handshake line, newline included
 * @param receiveBufferBytes size of one query receive call
 * @param maintenanceBufferBytes size of one maintenance-payload receive call
 */
public record ProtocolSettings(
    int handshakeMaxBytes, int receiveBufferBytes, int maintenanceBufferBytes) {

  /** Largest maintenance payload accepted, as a multiple of one receive. */
  static final int MAINTENANCE_READS_MAX = 64;

  public ProtocolSettings {
    if (handshakeMaxBytes < 1 || receiveBufferBytes < 1 || maintenanceBufferBytes < 1) {
      throw new IllegalArgumentException(
          "Buffer sizes must be >= 1, got: "
              + handshakeMaxBytes + "/" + receiveBufferBytes + "/" + maintenanceBufferBytes);
    }
  }
}
