/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.report;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import javax.imageio.ImageIO;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.macstab.oss.querygateway.model.PhaseMetrics;
import com.macstab.oss.querygateway.report.RenderedReport;
import com.macstab.oss.querygateway.report.ReportRenderer;
import com.macstab.oss.querygateway.report.ScenarioReport;
import com.macstab.oss.querygateway.util.Jsons;

import lombok.NonNull;

/**
 * Writes a scenario report as {@code plots/<timestamp>.png} plus {@code <timestamp>.json} under
 * the output directory.
 *
 * <p>The figure is a 3×2 grid of bar panels (memory, CPU, threads, descriptors, network), each with
 * pre/during/post bars, under a header with the average latency and throughput. It is drawn with
 * Java2D into an off-screen image, so no display is needed.
 *
 * <p>Rendering is serialized: two maintenance clients finishing in the same millisecond would
 * otherwise race for the same file names.
 */
public final class FileReportRenderer implements ReportRenderer {

  private static final DateTimeFormatter FILE_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");

  private static final int WIDTH = 1600;
  private static final int HEIGHT = 800;
  private static final int HEADER = 80;
  private static final int COLUMNS = 3;
  private static final int ROWS = 2;
  private static final String[] PHASES = {"Pre", "During", "Post"};
  private static final Color BAR = new Color(0x1f, 0x77, 0xb4);
  private static final Color GRID = new Color(0, 0, 0, 48);

  private final Path outputDir;
  private final Clock clock;

  public FileReportRenderer(@NonNull final Path outputDir) {
    this(outputDir, Clock.systemDefaultZone());
  }

  public FileReportRenderer(@NonNull final Path outputDir, @NonNull final Clock clock) {
    this.outputDir = outputDir;
    this.clock = clock;
  }

  @Override
  public synchronized RenderedReport render(@NonNull final ScenarioReport report)
      throws IOException {
    final var plotsDir = outputDir.resolve("plots");
    Files.createDirectories(plotsDir);

    final String stem = uniqueStem(plotsDir);
    final var imagePath = plotsDir.resolve(stem + ".png");
    final var jsonPath = outputDir.resolve(stem + ".json");

    ImageIO.write(drawFigure(report), "png", imagePath.toFile());
    Files.writeString(
        jsonPath,
        Jsons.mapper().writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(report));

    return new RenderedReport(imagePath, jsonPath);
  }

  // ==================== Private Methods ====================

  private String uniqueStem(final Path plotsDir) {
    final String base = LocalDateTime.now(clock).format(FILE_STAMP);
    String stem = base;
    int suffix = 1;
    while (Files.exists(plotsDir.resolve(stem + ".png"))) {
      stem = base + "_" + suffix++;
    }
    return stem;
  }

  private BufferedImage drawFigure(final ScenarioReport report) {
    final var image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
    final Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.setRenderingHint(
          RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, WIDTH, HEIGHT);

      g.setColor(Color.BLACK);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 16));
      g.drawString(
          String.format("Avg Latency: %.2f ms", report.averageLatencySeconds() * 1000.0), 16, 26);
      g.drawString(
          String.format("Avg Throughput: %.2f rows/s", report.averageThroughput()), 400, 26);
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 20));
      g.drawString("Scenario Averages over queries", WIDTH / 2 - 160, 60);

      final var usage = report.aggregatedMetrics();
      drawPanel(g, 0, "Memory Usage (avg)", "MB", usage.memoryMb(), "%.0f");
      drawPanel(g, 1, "CPU Usage (avg)", "%", usage.cpu(), "%.0f");
      drawPanel(g, 2, "Threads (avg)", "count", usage.threads(), "%.0f");
      drawPanel(g, 3, "Open FDs (avg)", "count", usage.fds(), "%.0f");
      drawPanel(g, 4, "Network Rate (avg)", "KB/s", usage.netKbps(), "%.1f");
    } finally {
      g.dispose();
    }
    return image;
  }

  private void drawPanel(
      final Graphics2D g,
      final int cell,
      final String title,
      final String unit,
      final PhaseMetrics values,
      final String format) {
    final int cellWidth = WIDTH / COLUMNS;
    final int cellHeight = (HEIGHT - HEADER) / ROWS;
    final int left = (cell % COLUMNS) * cellWidth + 60;
    final int top = HEADER + (cell / COLUMNS) * cellHeight + 40;
    final int plotWidth = cellWidth - 100;
    final int plotHeight = cellHeight - 90;
    final int baseline = top + plotHeight;

    g.setColor(Color.BLACK);
    g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 15));
    g.drawString(title, left + plotWidth / 2 - g.getFontMetrics().stringWidth(title) / 2, top - 14);
    g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
    g.drawString(unit, left - 50, top + plotHeight / 2);

    final double[] bars = {values.pre(), values.during(), values.post()};
    double max = 0.0;
    for (final double bar : bars) {
      max = Math.max(max, bar);
    }
    final double scale = max > 0 ? plotHeight / (max * 1.15) : 0.0;

    g.setColor(GRID);
    g.setStroke(new BasicStroke(1f));
    for (int i = 1; i <= 4; i++) {
      final int y = baseline - (plotHeight * i / 5);
      g.drawLine(left, y, left + plotWidth, y);
    }

    final int slot = plotWidth / bars.length;
    final int barWidth = slot * 3 / 5;
    for (int i = 0; i < bars.length; i++) {
      final int height = (int) Math.round(Math.max(0.0, bars[i]) * scale);
      final int x = left + i * slot + (slot - barWidth) / 2;
      g.setColor(BAR);
      g.fillRect(x, baseline - height, barWidth, height);
      g.setColor(Color.BLACK);
      final String label = String.format(format, bars[i]);
      final int labelWidth = g.getFontMetrics().stringWidth(label);
      g.drawString(label, x + (barWidth - labelWidth) / 2, baseline - height - 4);
      final int phaseWidth = g.getFontMetrics().stringWidth(PHASES[i]);
      g.drawString(PHASES[i], x + (barWidth - phaseWidth) / 2, baseline + 16);
    }

    g.drawLine(left, baseline, left + plotWidth, baseline);
    g.drawLine(left, top, left, baseline);
  }
}
