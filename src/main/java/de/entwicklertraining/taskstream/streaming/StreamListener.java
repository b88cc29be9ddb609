package de.entwicklertraining.taskstream.streaming;

/**
 * Callbacks of one stream session. They run on the thread that reads the stream, in frame
 * order.
 *
 * <p>A session calls at most one of {@link #onError(Throwable)} and
 * {@link #onComplete(StreamIds)}, at most once. A cancelled session calls neither, and
 * after cancellation {@link #onMessage(StreamEvent.DataEvent)} is not called again.
 */
public interface StreamListener {

    void onMessage(StreamEvent.DataEvent event);

    /**
     * The session failed: an application error frame, a rejected or failed connection,
     * or a stream that ended without the sentinel.
     *
     * @param error the failure
     */
    void onError(Throwable error);

    /**
     * The sentinel arrived.
     *
     * @param ids identifiers last seen on the stream
     */
    void onComplete(StreamIds ids);
}
