package io.idlequeue.model;

public record Specialization(int tankProgress, int healerProgress, int dpsProgress) {
    public static Specialization zero() {
        return new Specialization(0, 0, 0);
    }

    public boolean hasProgress() {
        return tankProgress != 0 || healerProgress != 0 || dpsProgress != 0;
    }
}
