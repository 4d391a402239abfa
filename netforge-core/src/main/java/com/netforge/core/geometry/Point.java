package com.netforge.core.geometry;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;

/**
 * A scene coordinate rounded to {@value #PRECISION} decimal places.
 *
 * <p>Rounding happens in the canonical constructor, so two points produced by
 * slightly different transforms of the same location compare equal.
 *
 * @param x horizontal scene coordinate
 * @param y vertical scene coordinate
 */
public record Point(double x, double y) implements Comparable<Point> {

    /** Number of decimal places kept. */
    public static final int PRECISION = 4;

    private static final Comparator<Point> ORDER =
        Comparator.comparingDouble(Point::x).thenComparingDouble(Point::y);

    public Point {
        x = round(x);
        y = round(y);
    }

    /**
     * Creates a point with both coordinates rounded.
     *
     * @param x horizontal coordinate
     * @param y vertical coordinate
     * @return rounded point
     */
    public static Point of(double x, double y) {
        return new Point(x, y);
    }

    /**
     * Returns this point moved by the given offset, rounded.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return translated point
     */
    public Point translate(double dx, double dy) {
        return of(x + dx, y + dy);
    }

    @Override
    public int compareTo(Point other) {
        return ORDER.compare(this, other);
    }

    private static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double rounded = BigDecimal.valueOf(value).setScale(PRECISION, RoundingMode.HALF_UP).doubleValue();
        // -0.0 and 0.0 must be the same key
        return rounded + 0.0;
    }
}
