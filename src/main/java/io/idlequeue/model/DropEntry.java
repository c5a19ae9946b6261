package io.idlequeue.model;

public record DropEntry(String itemId, int quantity, String rarity) {
}
