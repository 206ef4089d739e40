package com.example.tomograph.algorithm;

import java.util.List;
import java.util.stream.IntStream;

public class ForwardProjector {

    private final boolean parallel;

    public ForwardProjector(boolean parallel) {
        this.parallel = parallel;
    }

    // each angle is stretched onto 0..255 on its own
    public double[] project(double[][] canvas, ScanGeometry geometry, double alphaDegrees) {
        int side = canvas.length;
        List<Ray> rays = EmitterDetectorGeometry.rays(geometry, alphaDegrees);
        double[] sums = new double[rays.size()];
        for (int i = 0; i < sums.length; i++) {
            RayPath path = LineRasterizer.trace(rays.get(i));
            double sum = 0;
            for (int p = 0; p < path.length(); p++) {
                sum += canvas[Math.floorMod(path.x(p), side)][Math.floorMod(path.y(p), side)];
            }
            sums[i] = sum;
        }
        return ImageScaling.rescale(sums);
    }

    // returns [detector][scan]
    public double[][] projectAll(double[][] canvas, ScanGeometry geometry) {
        double[] angles = geometry.scanAngles();
        double[][] columns = new double[angles.length][];
        IntStream scans = IntStream.range(0, angles.length);
        if (parallel) {
            scans = scans.parallel();
        }
        // each scan writes only its own column
        scans.forEach(scan -> columns[scan] = project(canvas, geometry, angles[scan]));

        double[][] sinogram = new double[geometry.detectorCount()][angles.length];
        for (int scan = 0; scan < angles.length; scan++) {
            for (int detector = 0; detector < geometry.detectorCount(); detector++) {
                sinogram[detector][scan] = columns[scan][detector];
            }
        }
        return sinogram;
    }
}
