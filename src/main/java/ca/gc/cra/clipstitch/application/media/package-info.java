/**
 * Media use cases: segmentation ({@code cut}), concatenation ({@code combine}) and probing.
 * <p>Engines receive raw container bytes, drive the {@link ca.gc.cra.clipstitch.application.port.ContainerFormat}
 * port and return finished buffers. They never touch the filesystem; callers acquire and persist bytes.</p>
 * <p>Every call builds its own readers and destination builders, so an engine instance may be shared, but
 * nothing created inside a call escapes it before being finished.</p>
 * <p>Operational counters are reported via {@link ca.gc.cra.clipstitch.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.application.media;
