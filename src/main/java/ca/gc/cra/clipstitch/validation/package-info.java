/**
 * Input validation helpers shared by the CLI and configuration layer.
 * <p>Helpers throw {@link java.lang.IllegalArgumentException} with messages suitable for CLI output.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.validation;
