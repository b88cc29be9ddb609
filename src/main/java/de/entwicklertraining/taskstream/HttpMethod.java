package de.entwicklertraining.taskstream;

/**
 * HTTP verbs supported by {@link TaskStreamClient}.
 *
 * <p>The verb decides the default retry budget: idempotent verbs may be repeated after a
 * transient failure, non-idempotent ones are attempted exactly once unless the caller
 * overrides that explicitly.
 */
public enum HttpMethod {
    GET(true),
    POST(false),
    PUT(false),
    DELETE(true);

    private final boolean idempotent;

    HttpMethod(boolean idempotent) {
        this.idempotent = idempotent;
    }

    /**
     * Whether repeating the request cannot cause additional side effects.
     *
     * @return true for GET and DELETE
     */
    public boolean isIdempotent() {
        return idempotent;
    }
}
