/**
 * Logging setup helpers for the CLI.
 * <p>Engines log through SLF4J; this package only adjusts the Logback backend at startup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.logging;
