/**
 * Service layer of the subtitle pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.audio} - PCM format helpers, the {@code Chunker} and microphone capture</li>
 *   <li>{@code service.stt} - recognition engine contract and the whisper.cpp adapter</li>
 *   <li>{@code service.translate} - translation engine contract and the llama.cpp server adapter</li>
 *   <li>{@code service.context} - rolling conversation context used to bias translation</li>
 *   <li>{@code service.display} - display callbacks and the display queue dispatcher</li>
 *   <li>{@code service.pipeline} - stage workers, bounded queues and the orchestrator</li>
 *   <li>{@code service.metrics}, {@code service.health} - Micrometer and Actuator integration</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw the unchecked exceptions of
 * {@code com.phillippitts.livesubs.exception}.
 *
 * @see com.phillippitts.livesubs.service.pipeline.SubtitlePipeline
 */
package com.phillippitts.livesubs.service;
