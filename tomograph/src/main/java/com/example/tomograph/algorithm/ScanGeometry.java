package com.example.tomograph.algorithm;

public record ScanGeometry(int radius, int center, double spanDegrees, int detectorCount, int scanCount) {

    public static final double SWEEP_DEGREES = 180.0;

    public ScanGeometry {
        if (radius <= 0) {
            throw new InvalidGeometryException("Radius must be positive, got " + radius);
        }
        if (detectorCount <= 0) {
            throw new InvalidGeometryException("Detector count must be positive, got " + detectorCount);
        }
        if (scanCount <= 0) {
            throw new InvalidGeometryException("Scan count must be positive, got " + scanCount);
        }
        if (!(spanDegrees > 0)) {
            throw new InvalidGeometryException("Angle span must be positive, got " + spanDegrees);
        }
    }

    public static ScanGeometry forCanvas(CanvasGeometry canvas, double spanDegrees, int detectorCount, int scanCount) {
        return new ScanGeometry(canvas.radius(), canvas.center(), spanDegrees, detectorCount, scanCount);
    }

    // 0 to 180 degrees inclusive
    public double[] scanAngles() {
        return linspace(SWEEP_DEGREES, scanCount);
    }

    static double[] linspace(double stop, int count) {
        double[] samples = new double[count];
        if (count == 1) {
            return samples;
        }
        double step = stop / (count - 1);
        for (int i = 0; i < count; i++) {
            samples[i] = i * step;
        }
        samples[count - 1] = stop;
        return samples;
    }
}
