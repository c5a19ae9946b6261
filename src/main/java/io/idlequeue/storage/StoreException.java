package io.idlequeue.storage;

/**
 * Store failure. {@link #retryable()} is true only for lock contention, which is worth another attempt.
 */
public final class StoreException extends RuntimeException {
    private final boolean retryable;

    public StoreException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
