package io.idlequeue.model;

public record InventoryItem(String itemId, long quantity, long updatedAt) {
}
