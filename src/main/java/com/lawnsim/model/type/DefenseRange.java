package com.lawnsim.model.type;

/**
 * Horizontal interval relative to a plant's x where the plant can be reached.
 * Used both for melee (zombie bites, giant smashes) and for explosions.
 */
public final class DefenseRange {
    public static final DefenseRange DEFAULT_HIT = new DefenseRange(30, 50);
    public static final DefenseRange DEFAULT_EXPLODE = new DefenseRange(-50, 10);

    private final int left;
    private final int right;

    public DefenseRange(int left, int right) {
        if (left > right) {
            throw new IllegalArgumentException("left offset " + left + " exceeds right offset " + right);
        }
        this.left = left;
        this.right = right;
    }

    public int getLeft() { return left; }
    public int getRight() { return right; }

    public double absoluteLeft(double plantX) { return plantX + left; }
    public double absoluteRight(double plantX) { return plantX + right; }

    public boolean overlaps(double plantX, double fromX, double toX) {
        return fromX <= plantX + right && toX >= plantX + left;
    }

    @Override
    public String toString() {
        return "[" + left + ", " + right + "]";
    }
}
