package io.idlequeue.model;

public record QueueConfig(
        int maxQueueSize,
        boolean retryEnabled,
        int maxRetries,
        boolean validationEnabled,
        boolean syncEnabled
) {
    public static final int DEFAULT_MAX_QUEUE_SIZE = 50;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public QueueConfig {
        maxQueueSize = Math.max(1, maxQueueSize);
        maxRetries = Math.max(0, maxRetries);
    }

    public static QueueConfig defaults() {
        return new QueueConfig(DEFAULT_MAX_QUEUE_SIZE, true, DEFAULT_MAX_RETRIES, true, true);
    }

    /**
     * Retry budget for a task entering the queue. A task that asks for none gets the queue's budget, and no task
     * gets more than it.
     */
    public int retryBudget(int requested) {
        return requested <= 0 ? maxRetries : Math.min(requested, maxRetries);
    }
}
