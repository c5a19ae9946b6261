package io.idlequeue.engine;

public record CycleOutcome(
        int scanned,
        int progressed,
        int completed,
        int retried,
        int dropped,
        int paused,
        int conflicts,
        int busy,
        int failed,
        long startedAtMs,
        long finishedAtMs
) {
}
