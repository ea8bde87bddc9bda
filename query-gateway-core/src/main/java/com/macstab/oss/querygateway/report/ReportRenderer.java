/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.report;

import java.io.IOException;

/** Persists a scenario report as a figure plus a JSON summary. */
@FunctionalInterface
public interface ReportRenderer {

  /**
   * Renders {@code report}.
   *
   * @param report aggregate to render
   * @return paths of the written files
   * @throws IOException if the files cannot be written
   */
  RenderedReport render(ScenarioReport report) throws IOException;
}
