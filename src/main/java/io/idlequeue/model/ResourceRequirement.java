package io.idlequeue.model;

public record ResourceRequirement(String resourceId, int quantityRequired, int quantityAvailable) {
    public boolean sufficient() {
        return quantityAvailable >= quantityRequired;
    }
}
