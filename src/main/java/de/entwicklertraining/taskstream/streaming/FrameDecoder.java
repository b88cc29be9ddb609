package de.entwicklertraining.taskstream.streaming;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the bytes of a task stream into {@link StreamEvent}s.
 *
 * <p>The stream is a sequence of lines separated by {@code \n}. Lines starting with
 * {@code "data: "} are frames; all other lines are ignored. A frame is either the sentinel
 * {@code [DONE]} or a JSON object:
 * <pre>
 * data: {"task_id": "t1", "content": "Hello"}
 * data: {"conversation_id": "c1"}
 * data: [DONE]
 * </pre>
 *
 * <p>Bytes may arrive in chunks of any size; a line, and a UTF-8 character, may be split
 * across chunks. The emitted events only depend on the bytes, not on how they were split.
 * After a terminal event the decoder ignores everything that follows.
 *
 * <p>Instances are not thread-safe and are used for one connection only.
 */
public final class FrameDecoder {
    private static final Logger logger = LoggerFactory.getLogger(FrameDecoder.class);

    public static final String DATA_PREFIX = "data: ";
    public static final String SENTINEL = "[DONE]";

    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    // never holds a complete line between calls
    private final StringBuilder buffer = new StringBuilder();
    private byte[] pendingBytes = new byte[0];

    private StreamIds lastSeenIds = StreamIds.empty();
    private boolean terminated;
    private boolean finished;

    /**
     * Decodes the next chunk of bytes.
     *
     * @param bytes source array
     * @param offset start of the chunk
     * @param length chunk length
     * @return the events completed by this chunk, in order
     */
    public List<StreamEvent> feed(byte[] bytes, int offset, int length) {
        checkNotFinished();
        if (terminated) {
            return List.of();
        }
        ByteBuffer in;
        if (pendingBytes.length == 0) {
            in = ByteBuffer.wrap(bytes, offset, length);
        } else {
            byte[] joined = Arrays.copyOf(pendingBytes, pendingBytes.length + length);
            System.arraycopy(bytes, offset, joined, pendingBytes.length, length);
            in = ByteBuffer.wrap(joined);
        }
        decode(in, false);
        pendingBytes = new byte[in.remaining()];
        in.get(pendingBytes);
        return drainCompleteLines();
    }

    public List<StreamEvent> feed(byte[] bytes) {
        return feed(bytes, 0, bytes.length);
    }

    /**
     * Decodes already decoded text. Mixing this with byte input is only safe at character
     * boundaries.
     *
     * @param text the next chunk of text
     * @return the events completed by this chunk, in order
     */
    public List<StreamEvent> feed(String text) {
        checkNotFinished();
        if (terminated) {
            return List.of();
        }
        buffer.append(text);
        return drainCompleteLines();
    }

    /**
     * Signals the end of the input. A trailing line without {@code \n} is decoded like
     * any other line.
     *
     * @return the events of the trailing line, if any
     */
    public List<StreamEvent> finish() {
        checkNotFinished();
        finished = true;
        if (terminated) {
            return List.of();
        }
        decode(ByteBuffer.wrap(pendingBytes), true);
        pendingBytes = new byte[0];
        CharBuffer out = CharBuffer.allocate(16);
        utf8.flush(out);
        out.flip();
        buffer.append(out);

        List<StreamEvent> events = drainCompleteLines();
        if (!terminated && buffer.length() > 0) {
            String last = buffer.toString();
            buffer.setLength(0);
            processLine(last, events);
        }
        buffer.setLength(0);
        return events;
    }

    public StreamIds getLastSeenIds() {
        return lastSeenIds;
    }

    /**
     * @return true once {@link StreamEvent.Done} or {@link StreamEvent.ApplicationError} was emitted
     */
    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Text received but not yet forming a complete line.
     *
     * @return the pending partial line
     */
    String pendingText() {
        return buffer.toString();
    }

    private void decode(ByteBuffer in, boolean endOfInput) {
        CharBuffer out = CharBuffer.allocate(Math.max(16, in.remaining()));
        while (true) {
            CoderResult result = utf8.decode(in, out, endOfInput);
            if (result.isOverflow()) {
                out.flip();
                buffer.append(out);
                out.clear();
                continue;
            }
            break;
        }
        out.flip();
        buffer.append(out);
    }

    private List<StreamEvent> drainCompleteLines() {
        List<StreamEvent> events = new ArrayList<>();
        int start = 0;
        while (!terminated) {
            int newline = buffer.indexOf("\n", start);
            if (newline < 0) {
                break;
            }
            String line = buffer.substring(start, newline);
            start = newline + 1;
            processLine(line, events);
        }
        if (terminated) {
            buffer.setLength(0);
            pendingBytes = new byte[0];
        } else {
            buffer.delete(0, start);
        }
        return events;
    }

    private void processLine(String line, List<StreamEvent> events) {
        if (!line.startsWith(DATA_PREFIX)) {
            if (!line.isBlank()) {
                logger.debug("Ignoring non-data line: {}", line);
            }
            return;
        }
        String content = line.substring(DATA_PREFIX.length()).trim();

        if (SENTINEL.equals(content)) {
            terminated = true;
            events.add(StreamEvent.Done.INSTANCE);
            return;
        }

        JSONObject frame;
        try {
            frame = parseObject(content);
        } catch (JSONException e) {
            events.add(new StreamEvent.DecodeError(content, e.getMessage()));
            return;
        }

        lastSeenIds = lastSeenIds.merge(frame);

        if (isApplicationError(frame)) {
            terminated = true;
            events.add(toApplicationError(frame));
            return;
        }
        events.add(new StreamEvent.DataEvent(frame));
    }

    private static JSONObject parseObject(String content) {
        JSONTokener tokener = new JSONTokener(content);
        Object value = tokener.nextValue();
        if (!(value instanceof JSONObject)) {
            throw new JSONException("Frame is not a JSON object");
        }
        if (tokener.nextClean() != 0) {
            throw new JSONException("Unexpected content after JSON object");
        }
        return (JSONObject) value;
    }

    private static boolean isApplicationError(JSONObject frame) {
        return frame.has("code") && !frame.isNull("code")
                && frame.has("message") && !frame.isNull("message");
    }

    private static StreamEvent.ApplicationError toApplicationError(JSONObject frame) {
        Object code = frame.get("code");
        String message = String.valueOf(frame.get("message"));
        if (code instanceof Number number) {
            return new StreamEvent.ApplicationError(number.intValue(), message);
        }
        try {
            return new StreamEvent.ApplicationError(Integer.parseInt(String.valueOf(code).trim()), message);
        } catch (NumberFormatException e) {
            return new StreamEvent.ApplicationError(-1, code + ": " + message);
        }
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("Decoder already finished");
        }
    }
}
