package de.entwicklertraining.taskstream.streaming;

import java.time.Instant;

/**
 * Receives frames that could not be decoded. These never reach
 * {@link StreamListener#onMessage(StreamEvent.DataEvent)}.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void onDecodeError(Instant timestamp, StreamEvent.DecodeError error);
}
