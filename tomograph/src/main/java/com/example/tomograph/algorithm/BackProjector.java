package com.example.tomograph.algorithm;

import java.util.List;
import java.util.stream.IntStream;

public class BackProjector {

    private final boolean parallel;

    public BackProjector(boolean parallel) {
        this.parallel = parallel;
    }

    public void backProject(ReconstructionAccumulator accumulator, double[] readings,
                            ScanGeometry geometry, double alphaDegrees) {
        if (readings.length != geometry.detectorCount()) {
            throw new ShapeMismatchException("Got " + readings.length + " readings for "
                    + geometry.detectorCount() + " detectors");
        }
        List<Ray> rays = EmitterDetectorGeometry.rays(geometry, alphaDegrees);
        for (int i = 0; i < readings.length; i++) {
            accumulator.add(LineRasterizer.trace(rays.get(i)), readings[i]);
        }
    }

    // sinogram is [detector][scan]
    public ReconstructionAccumulator backProjectAll(double[][] sinogram, ScanGeometry geometry, int side) {
        if (sinogram.length != geometry.detectorCount()) {
            throw new ShapeMismatchException("Sinogram has " + sinogram.length + " detector rows, expected "
                    + geometry.detectorCount());
        }
        double[] angles = geometry.scanAngles();
        IntStream scans = IntStream.range(0, angles.length);
        if (!parallel) {
            ReconstructionAccumulator accumulator = new ReconstructionAccumulator(side);
            scans.forEach(scan -> backProject(accumulator, column(sinogram, scan), geometry, angles[scan]));
            return accumulator;
        }
        return scans.parallel().collect(
                () -> new ReconstructionAccumulator(side),
                (accumulator, scan) -> backProject(accumulator, column(sinogram, scan), geometry, angles[scan]),
                ReconstructionAccumulator::merge);
    }

    private static double[] column(double[][] sinogram, int scan) {
        double[] readings = new double[sinogram.length];
        for (int detector = 0; detector < sinogram.length; detector++) {
            readings[detector] = sinogram[detector][scan];
        }
        return readings;
    }
}
