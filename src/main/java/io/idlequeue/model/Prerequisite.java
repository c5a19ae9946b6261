package io.idlequeue.model;

public record Prerequisite(String type, String description, boolean met) {
}
