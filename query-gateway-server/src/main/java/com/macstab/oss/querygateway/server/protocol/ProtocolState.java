/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.protocol;

/**
 * Client connection states.
 *
 * <pre>{@code
 * HANDSHAKE --priority 1..9--> STREAMING --EOF/error--> CLOSED
 *     |
 *     +------priority 0------> MAINTENANCE --done----> CLOSED
 * }</pre>
 */
public enum ProtocolState {
  HANDSHAKE,
  STREAMING,
  MAINTENANCE,
  CLOSED
}
