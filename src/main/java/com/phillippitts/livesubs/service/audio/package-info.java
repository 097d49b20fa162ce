/**
 * Audio format handling and chunking.
 *
 * <p>Everything in the pipeline is 16 kHz, 16-bit signed, mono, little-endian PCM
 * ({@link com.phillippitts.livesubs.service.audio.AudioFormat}). Raw sample buffers from the
 * capture source are accumulated by {@link com.phillippitts.livesubs.service.audio.Chunker} into
 * fixed-duration {@link com.phillippitts.livesubs.domain.AudioChunk}s.
 *
 * @see com.phillippitts.livesubs.service.audio.capture.AudioSource
 */
package com.phillippitts.livesubs.service.audio;
