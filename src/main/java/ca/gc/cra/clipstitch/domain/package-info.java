/**
 * Domain layer of ClipStitch. Contains no I/O and depends on no adapter library.
 */
package ca.gc.cra.clipstitch.domain;
