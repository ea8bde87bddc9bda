/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * TCP wire protocol.
 *
 * <h2>Messages</h2>
 *
 * <ol>
 *   <li>Client sends one line with an ASCII priority: {@code 0} for maintenance, {@code 1} to
 *       {@code 9} for queries. Anything else means {@code 1}.
 *   <li>Priority 1-9: each send is one UTF-8 query. Each query is answered with one JSON line:
 *       <pre>{@code
 * {"metrics":{"cpu":{"pre":..,"during":..,"post":..},"memory_mb":{..},"threads":{..},
 *  "fds":{..},"net_kbps":{..}},"latency_s":0.012,"rows":1,"throughput":83.3,"source":"db"}
 * }</pre>
 *       or {@code {"error":"..."}} if the query failed. Replies may arrive out of submission order.
 *   <li>Priority 0: client sends a JSON array of latencies in seconds. The server writes a report
 *       and closes the connection without a reply.
 * </ol>
 */
package com.macstab.oss.querygateway.server.protocol;
