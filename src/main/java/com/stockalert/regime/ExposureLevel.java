package com.stockalert.regime;

/**
 * Exposure cap ladder, ordered from the highest cap to the floor.
 */
public enum ExposureLevel {
    FULL(1.00),
    HIGH(0.70),
    MODERATE(0.40),
    LOW(0.15),
    MINIMAL(0.05);

    private final double cap;

    ExposureLevel(double cap) {
        this.cap = cap;
    }

    public double cap() {
        return cap;
    }

    /** One rung lower; the floor stays where it is. */
    public ExposureLevel stepDown() {
        ExposureLevel[] ladder = values();
        return ladder[Math.min(ordinal() + 1, ladder.length - 1)];
    }

    /** One rung higher; the top stays where it is. */
    public ExposureLevel stepUp() {
        ExposureLevel[] ladder = values();
        return ladder[Math.max(ordinal() - 1, 0)];
    }
}
