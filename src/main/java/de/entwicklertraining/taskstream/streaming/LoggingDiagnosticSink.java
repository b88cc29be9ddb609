package de.entwicklertraining.taskstream.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Default sink: logs every malformed frame at warn level.
 */
public final class LoggingDiagnosticSink implements DiagnosticSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    private static final int MAX_LOGGED_FRAME_LENGTH = 500;

    @Override
    public void onDecodeError(Instant timestamp, StreamEvent.DecodeError error) {
        String raw = error.raw();
        if (raw.length() > MAX_LOGGED_FRAME_LENGTH) {
            raw = raw.substring(0, MAX_LOGGED_FRAME_LENGTH) + "...";
        }
        logger.warn("parse-error-{}: {} - frame: {}", timestamp.toEpochMilli(), error.reason(), raw);
    }
}
