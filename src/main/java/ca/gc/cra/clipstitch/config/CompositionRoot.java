package ca.gc.cra.clipstitch.config;

import ca.gc.cra.clipstitch.application.media.ConcatenationEngine;
import ca.gc.cra.clipstitch.application.media.ContainerProbe;
import ca.gc.cra.clipstitch.application.media.SegmentationEngine;
import ca.gc.cra.clipstitch.application.port.ContainerFormat;
import ca.gc.cra.clipstitch.application.port.MetricsPort;
import ca.gc.cra.clipstitch.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.clipstitch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.clipstitch.infrastructure.mp4.IsoContainerFormat;
import ca.gc.cra.clipstitch.infrastructure.persistence.ClipFileWriter;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the media use cases to concrete adapters.
 * <p><strong>Role:</strong> Composition root used by the CLI; tests construct engines directly with fakes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter ({@code metricsExporter=otlp|none}).</li>
 *   <li>Build engines over the mp4parser container adapter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods allocate fresh engines; not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final ContainerFormat containerFormat;

  /**
   * Creates a root whose metrics adapter follows the exporter setting.
   *
   * @param metricsExporter {@code otlp} or {@code none}
   */
  public CompositionRoot(String metricsExporter) {
    this(selectMetrics(metricsExporter), new IsoContainerFormat());
  }

  /**
   * Creates a root with explicit adapters.
   *
   * @param metrics metrics adapter; must not be {@code null}
   * @param containerFormat container adapter; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metrics, ContainerFormat containerFormat) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.containerFormat = Objects.requireNonNull(containerFormat, "containerFormat");
  }

  public SegmentationEngine segmentationEngine(CutConfig config) {
    Objects.requireNonNull(config, "config");
    return new SegmentationEngine(containerFormat, metrics, config.outOfRangePolicy(), config.maxSegments());
  }

  public ConcatenationEngine concatenationEngine() {
    return new ConcatenationEngine(containerFormat, metrics);
  }

  public ContainerProbe containerProbe() {
    return new ContainerProbe(containerFormat);
  }

  public ClipFileWriter clipFileWriter(boolean allowOverwrite) {
    return new ClipFileWriter(allowOverwrite);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Flushes and shuts down the metrics exporter, if any.
   */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }

  private static MetricsPort selectMetrics(String metricsExporter) {
    String normalized = metricsExporter == null ? "none" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("otlp")) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }
}
