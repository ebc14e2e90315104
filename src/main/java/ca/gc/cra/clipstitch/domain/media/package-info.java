/**
 * Domain values for container remuxing: tracks, samples, segment plans and typed failures.
 * <p><strong>Role:</strong> Shared vocabulary between the engines and the container adapter ports.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; payload arrays are cloned on the way in and out.</p>
 * <p><strong>Performance:</strong> Timestamp arithmetic stays in {@code long} ticks; see {@link ca.gc.cra.clipstitch.domain.media.TickMath}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.domain.media;
