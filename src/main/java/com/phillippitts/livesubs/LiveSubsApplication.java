package com.phillippitts.livesubs;

import com.phillippitts.livesubs.config.properties.AudioCaptureProperties;
import com.phillippitts.livesubs.config.properties.ContextProperties;
import com.phillippitts.livesubs.config.properties.PipelineProperties;
import com.phillippitts.livesubs.config.properties.TranslationProperties;
import com.phillippitts.livesubs.config.properties.WhisperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        ContextProperties.class,
        AudioCaptureProperties.class,
        WhisperProperties.class,
        TranslationProperties.class
})
public class LiveSubsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveSubsApplication.class, args);
    }

}
