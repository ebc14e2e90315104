/**
 * Configuration records, layered loading (defaults, YAML, CLI) and the composition root.
 * <p><strong>Role:</strong> Translates operator input into validated records and wired engines.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; loading happens once per CLI invocation.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's {@code SafeConstructor}; no arbitrary types are
 * instantiated.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.clipstitch.config;
