package io.idlequeue.model;

public record Bonus(String type, double value) {
    public boolean is(String bonusType) {
        return type != null && type.equalsIgnoreCase(bonusType);
    }
}
