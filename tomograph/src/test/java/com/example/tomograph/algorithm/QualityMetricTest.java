package com.example.tomograph.algorithm;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QualityMetricTest {

    @Test
    void identicalImagesHaveNoError() {
        INDArray x = Nd4j.createFromArray(new double[][]{{3, 1, 4}, {1, 5, 9}});

        assertThat(QualityMetric.rmse(x, x)).isEqualTo(0);
    }

    @Test
    void eachOperandIsScaledByItsOwnMaximum() {
        INDArray x = Nd4j.createFromArray(new double[][]{{1, 2}, {3, 4}});

        assertThat(QualityMetric.rmse(x, x.mul(10))).isCloseTo(0, within(1e-12));
    }

    @Test
    void disjointPixels() {
        INDArray a = Nd4j.createFromArray(new double[][]{{1, 0}});
        INDArray b = Nd4j.createFromArray(new double[][]{{0, 7}});

        assertThat(QualityMetric.rmse(a, b)).isCloseTo(1, within(1e-12));
    }

    @Test
    void zeroMaximumIsAnError() {
        INDArray blank = Nd4j.zeros(DataType.DOUBLE, 2, 2);
        INDArray x = Nd4j.createFromArray(new double[][]{{1, 0}, {0, 1}});

        assertThatThrownBy(() -> QualityMetric.rmse(blank, x)).isInstanceOf(DegenerateMetricException.class);
        assertThatThrownBy(() -> QualityMetric.rmse(x, blank)).isInstanceOf(DegenerateMetricException.class);
    }

    @Test
    void shapesMustAgree() {
        INDArray a = Nd4j.createFromArray(new double[][]{{1, 2}});
        INDArray b = Nd4j.createFromArray(new double[][]{{1}, {2}});

        assertThatThrownBy(() -> QualityMetric.rmse(a, b)).isInstanceOf(ShapeMismatchException.class);
    }
}
