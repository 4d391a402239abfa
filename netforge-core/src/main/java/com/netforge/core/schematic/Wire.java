package com.netforge.core.schematic;

import com.netforge.core.geometry.Point;

import java.util.List;

/**
 * A wire as the ordered list of corner points it physically passes through,
 * endpoints included.
 *
 * @param points routed point sequence
 */
public record Wire(List<Point> points) {

    /**
     * Compact constructor with validation.
     */
    public Wire {
        points = points == null ? List.of() : List.copyOf(points);
    }

    /**
     * Returns whether a point lies on one of this wire's segments.
     *
     * <p>Orthogonal segments are tested with {@code tolerance}; diagonal segments
     * by distance to the segment.
     *
     * @param p point to test
     * @param tolerance accepted distance
     * @return true when the point touches the wire
     */
    public boolean contains(Point p, double tolerance) {
        if (points.size() == 1) {
            return near(points.get(0), p, tolerance);
        }
        for (int i = 1; i < points.size(); i++) {
            if (onSegment(p, points.get(i - 1), points.get(i), tolerance)) {
                return true;
            }
        }
        return false;
    }

    private static boolean onSegment(Point p, Point a, Point b, double tol) {
        if (Math.abs(a.x() - b.x()) <= tol) {
            return Math.abs(p.x() - a.x()) <= tol
                && p.y() >= Math.min(a.y(), b.y()) - tol
                && p.y() <= Math.max(a.y(), b.y()) + tol;
        }
        if (Math.abs(a.y() - b.y()) <= tol) {
            return Math.abs(p.y() - a.y()) <= tol
                && p.x() >= Math.min(a.x(), b.x()) - tol
                && p.x() <= Math.max(a.x(), b.x()) + tol;
        }
        double dx = b.x() - a.x();
        double dy = b.y() - a.y();
        double t = ((p.x() - a.x()) * dx + (p.y() - a.y()) * dy) / (dx * dx + dy * dy);
        t = Math.max(0.0, Math.min(1.0, t));
        double cx = a.x() + t * dx;
        double cy = a.y() + t * dy;
        return Math.hypot(p.x() - cx, p.y() - cy) <= tol;
    }

    private static boolean near(Point a, Point b, double tol) {
        return Math.abs(a.x() - b.x()) <= tol && Math.abs(a.y() - b.y()) <= tol;
    }
}
