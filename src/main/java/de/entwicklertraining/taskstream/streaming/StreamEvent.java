package de.entwicklertraining.taskstream.streaming;

import org.json.JSONObject;

import java.util.Objects;

/**
 * One decoded frame of a task stream.
 *
 * <p>{@link ApplicationError} and {@link Done} are terminal: after either of them the
 * decoder emits nothing more. {@link DecodeError} is reported and decoding continues.
 * The four record types below are the only implementations.
 */
public sealed interface StreamEvent {

    /**
     * @return true if this event ends the stream
     */
    default boolean isTerminal() {
        return false;
    }

    /**
     * A JSON object frame carrying task output.
     *
     * @param payload the decoded frame
     */
    record DataEvent(JSONObject payload) implements StreamEvent {
        public DataEvent {
            Objects.requireNonNull(payload, "payload");
        }

        public String getString(String key) {
            return payload.optString(key, null);
        }

        // JSONObject has identity equality; compare by content instead
        @Override
        public boolean equals(Object other) {
            return other instanceof DataEvent event && payload.similar(event.payload);
        }

        @Override
        public int hashCode() {
            return payload.keySet().hashCode();
        }

        @Override
        public String toString() {
            return "DataEvent" + payload;
        }
    }

    /**
     * A frame reporting that the task failed on the server side.
     *
     * @param code the error code sent by the server, -1 if it was not numeric
     * @param message the error text
     */
    record ApplicationError(int code, String message) implements StreamEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * A data frame whose content could not be decoded.
     *
     * @param raw the frame content after the prefix
     * @param reason why decoding failed
     */
    record DecodeError(String raw, String reason) implements StreamEvent {
    }

    /**
     * The end-of-stream sentinel.
     */
    record Done() implements StreamEvent {
        public static final Done INSTANCE = new Done();

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
