/**
 * whisper.cpp recognition adapter.
 *
 * <p>{@link com.phillippitts.livesubs.service.stt.whisper.WhisperRecognitionEngine} writes each
 * chunk to a temporary WAV, runs whisper.cpp through
 * {@link com.phillippitts.livesubs.service.stt.whisper.WhisperProcessManager} and parses the JSON
 * output. Process creation goes through
 * {@link com.phillippitts.livesubs.service.stt.whisper.ProcessFactory} so tests can script it.
 *
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-medium.bin
 * stt.whisper.language=ja
 * stt.whisper.timeout-seconds=10
 * stt.whisper.threads=4
 * </pre>
 */
package com.phillippitts.livesubs.service.stt.whisper;
