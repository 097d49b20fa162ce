package com.phillippitts.livesubs.service.display;

import com.phillippitts.livesubs.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default headless display: writes subtitles to the log.
 */
public class LoggingDisplaySink implements DisplaySink {

    private static final Logger LOG = LogManager.getLogger(LoggingDisplaySink.class);

    private final int maxChars;

    public LoggingDisplaySink(int maxChars) {
        this.maxChars = maxChars;
    }

    @Override
    public void onPartial(String text) {
        LOG.debug("partial: {}", LogSanitizer.preview(text, maxChars));
    }

    @Override
    public void onTranslation(String original, String translation, String contextSummary) {
        LOG.info("subtitle: {} => {}", LogSanitizer.preview(original, maxChars),
                LogSanitizer.preview(translation, maxChars));
    }
}
