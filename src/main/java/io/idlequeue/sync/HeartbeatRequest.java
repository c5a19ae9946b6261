package io.idlequeue.sync;

public record HeartbeatRequest(long timestamp, long queueVersion) {
}
