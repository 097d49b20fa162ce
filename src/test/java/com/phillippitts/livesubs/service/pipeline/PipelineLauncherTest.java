package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.config.properties.PipelineProperties;
import com.phillippitts.livesubs.service.audio.capture.AudioDevice;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PipelineLauncher}.
 */
class PipelineLauncherTest {

    private final SubtitlePipeline pipeline = mock(SubtitlePipeline.class);

    @Test
    void shouldStartOnConfiguredDeviceWhenAutoStartEnabled() {
        // Arrange
        PipelineProperties props = new PipelineProperties(null, 3, null, null, null, null, null, null, true);
        when(pipeline.listDevices()).thenReturn(List.of(new AudioDevice(3, "USB Mic", 1, 16000)));
        when(pipeline.start(3)).thenReturn(true);

        // Act
        new PipelineLauncher(pipeline, props).onApplicationReady();

        // Assert
        verify(pipeline).start(3);
    }

    @Test
    void shouldLeavePipelineIdleWhenAutoStartDisabled() {
        PipelineProperties props = new PipelineProperties(null, null, null, null, null, null, null, null, false);

        new PipelineLauncher(pipeline, props).onApplicationReady();

        verify(pipeline, never()).start(anyInt());
        verify(pipeline, never()).listDevices();
    }

    @Test
    void shouldReportFailedStartWithoutThrowing() {
        when(pipeline.listDevices()).thenReturn(List.of());
        when(pipeline.start(-1)).thenReturn(false);
        when(pipeline.lastError()).thenReturn(new IllegalStateException("no model"));
        when(pipeline.state()).thenReturn(PipelineState.ERROR);

        new PipelineLauncher(pipeline, PipelineProperties.defaults()).onApplicationReady();

        verify(pipeline).start(-1);
        verify(pipeline).lastError();
    }

    @Test
    void shouldStopPipelineOnShutdown() {
        new PipelineLauncher(pipeline, PipelineProperties.defaults()).shutdown();

        verify(pipeline).stop();
    }
}
