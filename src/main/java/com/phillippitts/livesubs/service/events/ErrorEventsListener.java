package com.phillippitts.livesubs.service.events;

import com.phillippitts.livesubs.service.audio.capture.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs capture errors raised after start. Throttled per reason to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.deviceIndex() + '-' + e.reason();
        if (shouldLog(key, e.at())) {
            LOG.warn("Capture error on device {}: reason={}. Check microphone device & permissions.",
                    e.deviceIndex(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
