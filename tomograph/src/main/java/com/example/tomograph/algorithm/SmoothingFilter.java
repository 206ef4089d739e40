package com.example.tomograph.algorithm;

/**
 * 3x3 weighted mean: 15 at the center, 1 on each neighbour, divided by 23.
 * Borders are mirrored without repeating the edge pixel; arithmetic is
 * single precision.
 */
public final class SmoothingFilter {

    private static final float[][] KERNEL = kernel();

    private SmoothingFilter() {
    }

    private static float[][] kernel() {
        float[][] k = {{1, 1, 1}, {1, 15, 1}, {1, 1, 1}};
        float total = 0;
        for (float[] row : k) {
            for (float w : row) {
                total += w;
            }
        }
        for (float[] row : k) {
            for (int j = 0; j < row.length; j++) {
                row[j] /= total;
            }
        }
        return k;
    }

    public static double[][] apply(double[][] image) {
        int rows = image.length;
        int cols = image[0].length;
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                float[] p = new float[9];
                for (int di = 0; di < 3; di++) {
                    int r = reflect(i + di - 1, rows);
                    for (int dj = 0; dj < 3; dj++) {
                        int c = reflect(j + dj - 1, cols);
                        p[di * 3 + dj] = (float) image[r][c] * KERNEL[di][dj];
                    }
                }
                out[i][j] = sum(p);
            }
        }
        return out;
    }

    // pairwise order of an 8-wide unrolled float reduction, then the ninth term
    private static float sum(float[] p) {
        float head = ((p[0] + p[1]) + (p[2] + p[3])) + ((p[4] + p[5]) + (p[6] + p[7]));
        return head + p[8];
    }

    private static int reflect(int index, int size) {
        if (size == 1) {
            return 0;
        }
        if (index < 0) {
            return -index;
        }
        if (index >= size) {
            return 2 * size - 2 - index;
        }
        return index;
    }
}
