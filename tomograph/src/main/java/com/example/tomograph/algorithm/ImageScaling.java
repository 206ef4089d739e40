package com.example.tomograph.algorithm;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

public final class ImageScaling {

    public static final double DISPLAY_MAX = 255.0;

    private ImageScaling() {
    }

    // single precision; a constant input gives all zeros
    public static INDArray rescale(INDArray values) {
        INDArray res = values.castTo(DataType.FLOAT);
        res = res.sub(res.minNumber());
        Number max = res.maxNumber();
        if (max.doubleValue() > 0) {
            res = res.div(max);
        }
        return res.mul(DISPLAY_MAX).castTo(DataType.DOUBLE);
    }

    public static double[] rescale(double[] values) {
        return rescale(Nd4j.createFromArray(values)).toDoubleVector();
    }

    public static double[][] rescale(double[][] values) {
        return rescale(Nd4j.createFromArray(values)).toDoubleMatrix();
    }

    public static double[][] unpad(double[][] canvas, int height, int width) {
        int rows = canvas.length;
        int cols = rows == 0 ? 0 : canvas[0].length;
        if (height <= 0 || width <= 0) {
            throw new InvalidGeometryException("Output shape must be positive, got " + height + "x" + width);
        }
        if (height > rows || width > cols) {
            throw new ShapeMismatchException("Requested " + height + "x" + width
                    + " exceeds the " + rows + "x" + cols + " canvas");
        }
        int startRow = rows / 2 - height / 2;
        int startCol = cols / 2 - width / 2;
        double[][] out = new double[height][width];
        for (int row = 0; row < height; row++) {
            System.arraycopy(canvas[startRow + row], startCol, out[row], 0, width);
        }
        return out;
    }
}
