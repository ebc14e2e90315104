/**
 * <strong>Purpose:</strong> Ports the engines depend on: container parsing and writing, source acquisition, metrics.
 * <p><strong>Concurrency:</strong> Factories may be shared; readers and writers are confined to one operation.</p>
 * <p><strong>Security:</strong> Adapters receive untrusted container bytes and must reject malformed input with
 * {@link ca.gc.cra.clipstitch.domain.media.InvalidContainerException} rather than unchecked failures.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.application.port;
