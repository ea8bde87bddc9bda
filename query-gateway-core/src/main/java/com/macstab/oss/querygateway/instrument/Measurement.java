/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.instrument;

import com.macstab.oss.querygateway.model.ResourceUsage;

/**
 * Result of a measured call.
 *
 * @param result value returned by the call
 * @param usage resource usage before, during and after the call
 * @param latencySeconds wall-clock duration of the call alone
 * @param <T> result type
 */
public record Measurement<T>(T result, ResourceUsage usage, double latencySeconds) {}
