package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.config.properties.PipelineProperties;
import com.phillippitts.livesubs.service.audio.capture.AudioDevice;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the pipeline once the application is ready and stops it on shutdown.
 */
@Component
public class PipelineLauncher {

    private static final Logger LOG = LogManager.getLogger(PipelineLauncher.class);

    private final SubtitlePipeline pipeline;
    private final PipelineProperties props;

    public PipelineLauncher(SubtitlePipeline pipeline, PipelineProperties props) {
        this.pipeline = pipeline;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!props.isAutoStart()) {
            LOG.info("pipeline.auto-start=false; pipeline left idle");
            return;
        }
        logDevices();
        if (!pipeline.start(props.getAudioDeviceIndex())) {
            Throwable cause = pipeline.lastError();
            LOG.error("Pipeline failed to start: {}", cause != null ? cause.getMessage() : pipeline.state());
        }
    }

    private void logDevices() {
        List<AudioDevice> devices = pipeline.listDevices();
        if (devices.isEmpty()) {
            LOG.warn("No capture devices found");
            return;
        }
        for (AudioDevice device : devices) {
            LOG.info("Capture device {}", device);
        }
    }

    @PreDestroy
    public void shutdown() {
        pipeline.stop();
    }
}
