/**
 * Immutable records flowing through the subtitle pipeline.
 *
 * <p>Audio enters as {@link com.phillippitts.livesubs.domain.AudioChunk}, is recognized into
 * {@link com.phillippitts.livesubs.domain.RecognitionResult}s, and each finalized utterance is
 * translated against a {@link com.phillippitts.livesubs.domain.ContextSnapshot} into a
 * {@link com.phillippitts.livesubs.domain.TranslationResult}.
 */
package com.phillippitts.livesubs.domain;
