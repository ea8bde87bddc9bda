/* (C)2026 Christian Schnapka / Macstab GmbH */

/** Pending-task queue and the strategies that pick the next task. */
package com.macstab.oss.querygateway.scheduler;
