package io.idlequeue.model;

public record TaskProgress(String taskId, double progress, long timeRemaining, boolean running, boolean paused) {
    public static TaskProgress idle() {
        return new TaskProgress(null, 0.0d, 0L, false, false);
    }
}
