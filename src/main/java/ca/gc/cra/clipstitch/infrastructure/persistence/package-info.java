/**
 * Filesystem persistence for finished containers.
 * <p><strong>Role:</strong> Used by the CLI only; the engines never touch the filesystem.</p>
 */
package ca.gc.cra.clipstitch.infrastructure.persistence;
