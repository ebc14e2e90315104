/**
 * Command-line adapters: argument parsing, settings resolution and exit-code mapping.
 * <p><strong>Role:</strong> Outermost layer; converts exceptions from the engines into {@link ca.gc.cra.clipstitch.api.ExitCode}s.</p>
 */
package ca.gc.cra.clipstitch.api;
