package de.entwicklertraining.taskstream.streaming;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent decode errors in memory, dropping the oldest once the capacity is
 * reached. Optionally forwards every entry to another sink.
 */
public final class RecordingDiagnosticSink implements DiagnosticSink {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final DiagnosticSink delegate;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public RecordingDiagnosticSink() {
        this(DEFAULT_CAPACITY, null);
    }

    /**
     * @param capacity maximum number of entries kept (must be >= 1)
     * @param delegate sink that additionally receives every entry, or null
     */
    public RecordingDiagnosticSink(int capacity, DiagnosticSink delegate) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 but was " + capacity);
        }
        this.capacity = capacity;
        this.delegate = delegate;
    }

    @Override
    public void onDecodeError(Instant timestamp, StreamEvent.DecodeError error) {
        synchronized (entries) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(new Entry(timestamp, error));
        }
        if (delegate != null) {
            delegate.onDecodeError(timestamp, error);
        }
    }

    /**
     * @return the recorded entries, oldest first
     */
    public List<Entry> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    /**
     * One recorded decode error.
     *
     * @param timestamp when the frame was decoded
     * @param error the error
     */
    public record Entry(Instant timestamp, StreamEvent.DecodeError error) {
        /**
         * @return the key the entry is known by, {@code parse-error-<epoch millis>}
         */
        public String key() {
            return "parse-error-" + timestamp.toEpochMilli();
        }
    }
}
