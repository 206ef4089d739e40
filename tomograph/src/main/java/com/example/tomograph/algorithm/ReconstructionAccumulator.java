package com.example.tomograph.algorithm;

/**
 * Running sums and hit counts of backprojected rays. Not thread safe.
 */
public class ReconstructionAccumulator {

    private final int side;
    private final double[][] sums;
    private final int[][] hits;
    // id of the last ray that touched each pixel
    private final int[][] lastRay;
    private int rayId;

    public ReconstructionAccumulator(int side) {
        if (side <= 0) {
            throw new InvalidGeometryException("Canvas side must be positive, got " + side);
        }
        this.side = side;
        this.sums = new double[side][side];
        this.hits = new int[side][side];
        this.lastRay = new int[side][side];
    }

    public int side() {
        return side;
    }

    // a pixel the wrapped path lists twice is updated once
    public void add(RayPath path, double value) {
        rayId++;
        for (int p = 0; p < path.length(); p++) {
            int row = Math.floorMod(path.x(p), side);
            int col = Math.floorMod(path.y(p), side);
            if (lastRay[row][col] == rayId) {
                continue;
            }
            lastRay[row][col] = rayId;
            sums[row][col] += value;
            hits[row][col]++;
        }
    }

    public ReconstructionAccumulator merge(ReconstructionAccumulator other) {
        if (other.side != side) {
            throw new ShapeMismatchException("Cannot merge a " + other.side + " canvas into a " + side + " canvas");
        }
        for (int row = 0; row < side; row++) {
            for (int col = 0; col < side; col++) {
                sums[row][col] += other.sums[row][col];
                hits[row][col] += other.hits[row][col];
            }
        }
        return this;
    }

    public double sum(int row, int col) {
        return sums[row][col];
    }

    public int hits(int row, int col) {
        return hits[row][col];
    }

    // unreached pixels count as one hit and stay 0
    public double[][] normalize() {
        double[][] mean = new double[side][side];
        for (int row = 0; row < side; row++) {
            for (int col = 0; col < side; col++) {
                int count = hits[row][col] == 0 ? 1 : hits[row][col];
                mean[row][col] = sums[row][col] / count;
            }
        }
        return mean;
    }
}
