package com.example.tomograph.algorithm;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;

import java.util.Arrays;

public final class QualityMetric {

    private QualityMetric() {
    }

    public static double rmse(INDArray original, INDArray reconstructed) {
        if (!Arrays.equals(original.shape(), reconstructed.shape())) {
            throw new ShapeMismatchException("Cannot compare shapes " + Arrays.toString(original.shape())
                    + " and " + Arrays.toString(reconstructed.shape()));
        }
        INDArray a = normalized(original, "original");
        INDArray b = normalized(reconstructed, "reconstructed");
        INDArray diff = a.sub(b);
        double mse = diff.mul(diff).meanNumber().doubleValue();
        return Math.sqrt(mse);
    }

    private static INDArray normalized(INDArray image, String name) {
        INDArray values = image.castTo(DataType.DOUBLE);
        double max = values.maxNumber().doubleValue();
        if (max == 0) {
            throw new DegenerateMetricException("The " + name + " image has maximum 0");
        }
        return values.div(max);
    }
}
