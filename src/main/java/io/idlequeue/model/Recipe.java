package io.idlequeue.model;

public record Recipe(String recipeId, String name, int requiredLevel) {
}
