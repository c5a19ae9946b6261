package io.idlequeue.engine;

public enum ProcessOutcome {
    IDLE,
    PAUSED,
    PROGRESSED,
    COMPLETED,
    RETRIED,
    DROPPED,
    CONFLICT,
    BUSY
}
