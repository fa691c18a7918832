package com.dosify.node.remote;

/**
 * Failure reported by the remote document store.
 */
public class RemoteStoreException extends RuntimeException {

    /**
     * Failure categories. UNAVAILABLE and PERMISSION_DENIED make the remote tier unusable for
     * the current call and trigger local fallback; they are never surfaced to the caller directly.
     */
    public enum Kind {
        UNAVAILABLE,
        PERMISSION_DENIED,
        NOT_FOUND,
        PRECONDITION_FAILED
    }

    private final Kind kind;

    public RemoteStoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RemoteStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isUnavailable() {
        return kind == Kind.UNAVAILABLE || kind == Kind.PERMISSION_DENIED;
    }
}
