package com.example.tomograph.algorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Places emitters and detectors on the circle enclosing the canvas for a
 * given scan angle.
 *
 * <p>Detectors cover {@code [alpha - span/2, alpha + span/2]}; emitters use the
 * same arc turned by 180 degrees and listed in reverse, so emitter {@code i}
 * faces detector {@code i}. Coordinates are floored, never rounded, and are
 * offset by {@code -center}, which puts them in {@code [-side, 0]}.
 */
public final class EmitterDetectorGeometry {

    private EmitterDetectorGeometry() {
    }

    public static int[][] detectors(ScanGeometry geometry, double alphaDegrees) {
        double shift = Math.toRadians(alphaDegrees - geometry.spanDegrees() / 2);
        return circlePoints(shift, geometry);
    }

    public static int[][] emitters(ScanGeometry geometry, double alphaDegrees) {
        double shift = Math.toRadians(alphaDegrees - geometry.spanDegrees() / 2 + 180);
        int[][] points = circlePoints(shift, geometry);
        int[][] reversed = new int[points.length][];
        for (int i = 0; i < points.length; i++) {
            reversed[i] = points[points.length - 1 - i];
        }
        return reversed;
    }

    public static List<Ray> rays(ScanGeometry geometry, double alphaDegrees) {
        int[][] emitters = emitters(geometry, alphaDegrees);
        int[][] detectors = detectors(geometry, alphaDegrees);
        List<Ray> rays = new ArrayList<>(emitters.length);
        for (int i = 0; i < emitters.length; i++) {
            rays.add(new Ray(emitters[i][0], emitters[i][1], detectors[i][0], detectors[i][1]));
        }
        return rays;
    }

    private static int[][] circlePoints(double shift, ScanGeometry geometry) {
        double[] offsets = ScanGeometry.linspace(Math.toRadians(geometry.spanDegrees()), geometry.detectorCount());
        int radius = geometry.radius();
        int center = geometry.center();
        int[][] points = new int[offsets.length][2];
        for (int i = 0; i < offsets.length; i++) {
            double angle = offsets[i] + shift;
            points[i][0] = (int) Math.floor(radius * Math.cos(angle) - center);
            points[i][1] = (int) Math.floor(radius * Math.sin(angle) - center);
        }
        return points;
    }
}
