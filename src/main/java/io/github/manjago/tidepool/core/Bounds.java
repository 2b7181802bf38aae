package io.github.manjago.tidepool.core;

/**
 * Axis-aligned rectangle, inclusive on both ends.
 */
public record Bounds(double minX, double minY, double maxX, double maxY) {

    public Bounds {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(String.format(
                    "Empty bounds: [%.1f, %.1f] x [%.1f, %.1f]", minX, maxX, minY, maxY));
        }
    }

    public double clampX(double x) {
        return Math.max(minX, Math.min(maxX, x));
    }

    public double clampY(double y) {
        return Math.max(minY, Math.min(maxY, y));
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }
}
