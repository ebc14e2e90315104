/**
 * Metrics adapters bridging {@link ca.gc.cra.clipstitch.application.port.MetricsPort} to OpenTelemetry or a no-op.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code cut.*} and {@code combine.*} namespaces.</p>
 * <p><strong>Security:</strong> Never exports payload bytes; only counts and latencies.</p>
 */
package ca.gc.cra.clipstitch.infrastructure.metrics;
