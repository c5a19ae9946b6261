package io.idlequeue.model;

public record ItemStack(String itemId, int quantity) {
}
