/**
 * Application configuration.
 *
 * <p>{@code config.properties} holds the validated {@code @ConfigurationProperties} types bound
 * from {@code application.properties}; {@code config.pipeline} wires the orchestrator and its
 * context manager.
 *
 * @see com.phillippitts.livesubs.config.pipeline.PipelineConfig
 */
package com.phillippitts.livesubs.config;
