package com.example.tomograph.algorithm;

/**
 * Integer line tracing between two grid points.
 *
 * <p>Steps one pixel at a time along the axis of greater extent and rounds
 * the other coordinate half-to-even from the line equation.
 */
public final class LineRasterizer {

    private LineRasterizer() {
    }

    public static RayPath trace(Ray ray) {
        return trace(ray.emitterX(), ray.emitterY(), ray.detectorX(), ray.detectorY());
    }

    public static RayPath trace(int x0, int y0, int x1, int y1) {
        boolean steep = Math.abs(y1 - y0) > Math.abs(x1 - x0);
        if (steep) {
            int t = x0;
            x0 = y0;
            y0 = t;
            t = x1;
            x1 = y1;
            y1 = t;
        }
        double slope = x1 != x0 ? (double) (y1 - y0) / (x1 - x0) : 1;
        double intercept = y0 - slope * x0;
        int step = x0 < x1 ? 1 : -1;
        int length = Math.abs(x1 - x0) + 1;

        int[] driving = new int[length];
        int[] dependent = new int[length];
        for (int i = 0; i < length; i++) {
            int x = x0 + i * step;
            driving[i] = x;
            dependent[i] = (int) Math.rint(slope * x + intercept);
        }
        return steep ? new RayPath(dependent, driving) : new RayPath(driving, dependent);
    }
}
