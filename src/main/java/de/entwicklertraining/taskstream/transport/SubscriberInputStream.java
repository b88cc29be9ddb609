package de.entwicklertraining.taskstream.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bridges a {@code Flow.Publisher<List<ByteBuffer>>} response body to a blocking
 * {@link InputStream}, requesting one batch of buffers at a time.
 *
 * <p>{@link #close()} may be called from any thread. It cancels the subscription and
 * wakes a reader blocked in {@link #read(byte[], int, int)}, which then fails with an
 * IOException.
 */
final class SubscriberInputStream extends InputStream implements Flow.Subscriber<List<ByteBuffer>> {

    // identity marker, never equal to a batch delivered by the publisher
    private static final List<ByteBuffer> END = Collections.unmodifiableList(new ArrayList<>());

    private final BlockingQueue<List<ByteBuffer>> batches = new LinkedBlockingQueue<>();
    private volatile Flow.Subscription subscription;
    private volatile Throwable failure;
    private volatile boolean closed;

    private Iterator<ByteBuffer> currentBatch = Collections.emptyIterator();
    private ByteBuffer currentBuffer;
    private boolean finished;

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        if (closed) {
            subscription.cancel();
            return;
        }
        this.subscription = subscription;
        subscription.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> item) {
        batches.offer(item);
    }

    @Override
    public void onError(Throwable throwable) {
        failure = throwable;
        batches.offer(END);
    }

    @Override
    public void onComplete() {
        batches.offer(END);
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n < 0 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] target, int offset, int length) throws IOException {
        if (length == 0) {
            return 0;
        }
        ByteBuffer buffer = nextBuffer();
        if (buffer == null) {
            return -1;
        }
        int n = Math.min(length, buffer.remaining());
        buffer.get(target, offset, n);
        return n;
    }

    private ByteBuffer nextBuffer() throws IOException {
        while (true) {
            if (closed) {
                throw new IOException("Stream closed");
            }
            if (currentBuffer != null && currentBuffer.hasRemaining()) {
                return currentBuffer;
            }
            if (currentBatch.hasNext()) {
                currentBuffer = currentBatch.next();
                continue;
            }
            if (finished) {
                if (failure != null) {
                    throw new IOException("Response body failed: " + failure.getMessage(), failure);
                }
                return null;
            }
            List<ByteBuffer> batch;
            try {
                batch = batches.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for response data");
            }
            if (batch == END) {
                finished = true;
                continue;
            }
            currentBatch = batch.iterator();
            currentBuffer = null;
            Flow.Subscription s = subscription;
            if (s != null) {
                s.request(1);
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Flow.Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        batches.offer(END);
    }
}
