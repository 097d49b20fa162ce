package com.phillippitts.livesubs.config.pipeline;

import com.phillippitts.livesubs.config.properties.ContextProperties;
import com.phillippitts.livesubs.config.properties.PipelineProperties;
import com.phillippitts.livesubs.service.audio.capture.AudioSource;
import com.phillippitts.livesubs.service.context.ConcatenatingSummaryStrategy;
import com.phillippitts.livesubs.service.context.ContextManager;
import com.phillippitts.livesubs.service.context.SummaryStrategy;
import com.phillippitts.livesubs.service.display.LoggingDisplaySink;
import com.phillippitts.livesubs.service.metrics.PipelineMetrics;
import com.phillippitts.livesubs.service.pipeline.PipelineMetricsPublisher;
import com.phillippitts.livesubs.service.pipeline.SubtitlePipeline;
import com.phillippitts.livesubs.service.stt.RecognitionEngine;
import com.phillippitts.livesubs.service.translate.TranslationEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the subtitle pipeline and its context manager explicitly so that tests and alternative
 * front ends can construct the same graph without Spring.
 */
@Configuration
public class PipelineConfig {

    /** Longest subtitle fragment written to the log by the default display sink. */
    static final int LOG_DISPLAY_MAX_CHARS = 120;

    @Bean
    @ConditionalOnMissingBean(SummaryStrategy.class)
    public SummaryStrategy summaryStrategy(ContextProperties contextProps) {
        return new ConcatenatingSummaryStrategy(contextProps.getMaxSummaryLength());
    }

    @Bean
    public ContextManager contextManager(ContextProperties contextProps, SummaryStrategy summaryStrategy) {
        return new ContextManager(contextProps.getWindowSize(), contextProps.getUpdateIntervalTurns(),
                summaryStrategy);
    }

    /**
     * Metrics publisher; falls back to {@link PipelineMetricsPublisher#NOOP} when no meter registry
     * is available.
     */
    @Bean
    public PipelineMetricsPublisher pipelineMetricsPublisher(ObjectProvider<PipelineMetrics> metrics) {
        PipelineMetrics available = metrics.getIfAvailable();
        return available != null ? new PipelineMetricsPublisher(available) : PipelineMetricsPublisher.NOOP;
    }

    @Bean
    public LoggingDisplaySink loggingDisplaySink() {
        return new LoggingDisplaySink(LOG_DISPLAY_MAX_CHARS);
    }

    @Bean
    public SubtitlePipeline subtitlePipeline(RecognitionEngine recognitionEngine,
                                             TranslationEngine translationEngine,
                                             AudioSource audioSource,
                                             ContextManager contextManager,
                                             PipelineProperties pipelineProps,
                                             ContextProperties contextProps,
                                             PipelineMetricsPublisher metricsPublisher,
                                             LoggingDisplaySink loggingDisplaySink) {
        return SubtitlePipeline.builder()
                .recognitionEngine(recognitionEngine)
                .translationEngine(translationEngine)
                .audioSource(audioSource)
                .contextManager(contextManager)
                .properties(pipelineProps)
                .contextProperties(contextProps)
                .metrics(metricsPublisher)
                .displaySink(loggingDisplaySink)
                .build();
    }
}
