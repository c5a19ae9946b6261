package io.idlequeue.model;

public record CurrentActivity(TaskType type, String subType, long startedAt) {
}
