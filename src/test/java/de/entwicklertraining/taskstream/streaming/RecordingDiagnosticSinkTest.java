package de.entwicklertraining.taskstream.streaming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecordingDiagnosticSinkTest {

    @Test
    @DisplayName("Entries are keyed by their timestamp")
    void testEntryKey() {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink();
        Instant now = Instant.ofEpochMilli(1_700_000_000_123L);

        sink.onDecodeError(now, new StreamEvent.DecodeError("{bad", "Expected a ':'"));

        RecordingDiagnosticSink.Entry entry = sink.getEntries().get(0);
        assertEquals("parse-error-1700000000123", entry.key());
        assertEquals("{bad", entry.error().raw());
    }

    @Test
    @DisplayName("Oldest entries are dropped at capacity")
    void testCapacity() {
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink(2, null);
        for (int i = 0; i < 5; i++) {
            sink.onDecodeError(Instant.ofEpochMilli(i), new StreamEvent.DecodeError("raw" + i, "reason"));
        }

        List<RecordingDiagnosticSink.Entry> entries = sink.getEntries();
        assertEquals(2, entries.size());
        assertEquals("raw3", entries.get(0).error().raw());
        assertEquals("raw4", entries.get(1).error().raw());

        sink.clear();
        assertTrue(sink.getEntries().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new RecordingDiagnosticSink(0, null));
    }

    @Test
    @DisplayName("Every entry is forwarded to the delegate")
    void testDelegate() {
        List<StreamEvent.DecodeError> forwarded = new ArrayList<>();
        RecordingDiagnosticSink sink = new RecordingDiagnosticSink(1, (timestamp, error) -> forwarded.add(error));

        sink.onDecodeError(Instant.now(), new StreamEvent.DecodeError("a", "r"));
        sink.onDecodeError(Instant.now(), new StreamEvent.DecodeError("b", "r"));

        assertEquals(2, forwarded.size());
        assertEquals(1, sink.getEntries().size());
    }
}
