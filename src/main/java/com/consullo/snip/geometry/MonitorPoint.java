package com.consullo.snip.geometry;

/**
 * A point in MONITOR space: the logical coordinates the window manager reports, relative to the active
 * monitor's origin.
 *
 * @param x x coordinate
 * @param y y coordinate
 * @since 1.0
 */
public record MonitorPoint(double x, double y) {
}
