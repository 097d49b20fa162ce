/**
 * Application exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend {@link com.phillippitts.livesubs.exception.LiveSubsException}.
 * They fall into two groups:
 * <ul>
 *   <li>Fatal at startup: {@link com.phillippitts.livesubs.exception.ModelLoadException},
 *       {@link com.phillippitts.livesubs.exception.AudioSourceException}. The pipeline moves to
 *       {@code ERROR} and {@code start} reports failure.</li>
 *   <li>Transient per item: {@link com.phillippitts.livesubs.exception.RecognitionException},
 *       {@link com.phillippitts.livesubs.exception.TranslationException}. The stage logs, skips the
 *       item and continues.</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.livesubs.exception.PipelineException} marks a broken orchestration
 * invariant and is always fatal.
 */
package com.phillippitts.livesubs.exception;
