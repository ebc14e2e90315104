/**
 * ISO base media (MP4) adapter for the container ports, built on mp4parser.
 * <p><strong>Role:</strong> Infrastructure; the only package that imports mp4parser types.</p>
 * <p><strong>Concurrency:</strong> Readers and writers are confined to one engine call.</p>
 * <p><strong>Security:</strong> Inputs are untrusted; every parse failure is reported as
 * {@link ca.gc.cra.clipstitch.domain.media.InvalidContainerException}.</p>
 * <p>Fragmented files ({@code moof}) are read from their {@code moov} sample tables only.</p>
 */
package ca.gc.cra.clipstitch.infrastructure.mp4;
