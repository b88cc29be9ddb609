package de.entwicklertraining.taskstream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A response body the test writes to while the client reads it. {@link #close()} releases a
 * blocked read, like a real connection being torn down.
 */
public class FeedableInputStream extends InputStream {
    private static final byte[] END = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private byte[] current;
    private int position;
    private boolean ended;

    public void push(String text) {
        chunks.add(text.getBytes(StandardCharsets.UTF_8));
    }

    public void push(byte[] bytes) {
        chunks.add(bytes.clone());
    }

    public void end() {
        chunks.add(END);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n < 0 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException {
        while (current == null || position == current.length) {
            if (closed.get()) {
                throw new IOException("Stream closed");
            }
            if (ended) {
                return -1;
            }
            try {
                byte[] next = chunks.take();
                if (next == END) {
                    ended = true;
                    continue;
                }
                current = next;
                position = 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted", e);
            }
        }
        if (closed.get()) {
            throw new IOException("Stream closed");
        }
        int n = Math.min(length, current.length - position);
        System.arraycopy(current, position, target, offset, n);
        position += n;
        return n;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            chunks.add(END);
        }
    }
}
