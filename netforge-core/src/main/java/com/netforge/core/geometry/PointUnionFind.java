package com.netforge.core.geometry;

import java.util.List;

/**
 * Union-find over rounded scene coordinates.
 *
 * <p>Two ports are on the same electrical node when their coordinates end up
 * in the same group.
 */
public class PointUnionFind extends DisjointSet<Point> {

    /**
     * Adds every point of a routed path and unions consecutive points, so the
     * whole path becomes one conductive island.
     *
     * @param path ordered points a wire passes through
     */
    public void addPath(List<Point> path) {
        if (path.isEmpty()) {
            return;
        }
        Point previous = path.get(0);
        add(previous);
        for (Point point : path.subList(1, path.size())) {
            union(previous, point);
            previous = point;
        }
    }
}
