/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Dispatcher pool and cache-aside execution (NO Spring dependencies).
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * client handler --enqueue--> TaskQueue
 *                                |  aging-priority selection
 *                                v
 * DispatchWorker (x N) --borrow--> ConnectionPool (N connections)
 *        |
 *        +--> QueryExecutor: fingerprint -> cache hit?  --yes--> reply (source=cache)
 *        |                                    |no
 *        |                                    v
 *        |                    InstrumentationCollector(execute) -> ledger -> cache put
 *        v
 *      reply on the task's connection, return the connection
 * }</pre>
 *
 * <h2>Sizing</h2>
 *
 * <p>Worker count equals pool size, so a worker never waits on the pool for long and no connection
 * sits idle while work is queued.
 *
 * <h2>Locks</h2>
 *
 * <p>Queue, pool, ledger and the in-process cache each have their own lock. A worker holds at most
 * one of them at a time and none while a query or a cache call runs.
 */
package com.macstab.oss.querygateway.dispatch;
