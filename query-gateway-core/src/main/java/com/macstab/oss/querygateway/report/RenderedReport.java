/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import java.nio.file.Path;

/**
 * Files written for one report.
 *
 * @param imagePath rendered figure
 * @param jsonPath JSON summary
 */
public record RenderedReport(Path imagePath, Path jsonPath) {}
