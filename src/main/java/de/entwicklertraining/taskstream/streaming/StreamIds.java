package de.entwicklertraining.taskstream.streaming;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Identifiers last seen on a stream. Unseen identifiers are empty strings.
 *
 * @param conversationId value of {@code conversation_id}
 * @param taskId value of {@code task_id}
 * @param messageId value of {@code message_id}
 */
public record StreamIds(String conversationId, String taskId, String messageId) {
    static final String CONVERSATION_ID = "conversation_id";
    static final String TASK_ID = "task_id";
    static final String MESSAGE_ID = "message_id";

    private static final StreamIds EMPTY = new StreamIds("", "", "");

    public StreamIds {
        conversationId = Objects.requireNonNullElse(conversationId, "");
        taskId = Objects.requireNonNullElse(taskId, "");
        messageId = Objects.requireNonNullElse(messageId, "");
    }

    public static StreamIds empty() {
        return EMPTY;
    }

    /**
     * Takes over the identifiers present on a frame. Identifiers missing on the frame,
     * or null there, keep their previous value.
     *
     * @param frame a decoded frame
     * @return the merged identifiers
     */
    public StreamIds merge(JSONObject frame) {
        return new StreamIds(
                pick(frame, CONVERSATION_ID, conversationId),
                pick(frame, TASK_ID, taskId),
                pick(frame, MESSAGE_ID, messageId));
    }

    private static String pick(JSONObject frame, String key, String previous) {
        if (!frame.has(key) || frame.isNull(key)) {
            return previous;
        }
        return String.valueOf(frame.get(key));
    }
}
