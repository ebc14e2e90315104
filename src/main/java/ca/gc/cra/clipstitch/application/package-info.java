/**
 * Application layer orchestration for ClipStitch.
 * <p><strong>Role:</strong> Hosts the cut, combine and probe use cases and the ports they drive.</p>
 * <p><strong>Concurrency:</strong> Every call is single-threaded and owns its readers, writers and builders.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code cut.*} and {@code combine.*}.</p>
 */
package ca.gc.cra.clipstitch.application;
