package io.idlequeue.engine;

public final class QueueFullException extends RuntimeException {
    private final int maxQueueSize;

    public QueueFullException(String playerId, int maxQueueSize) {
        super("Task queue for " + playerId + " is full (max " + maxQueueSize + ")");
        this.maxQueueSize = maxQueueSize;
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }
}
