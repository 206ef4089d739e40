package com.example.tomograph.algorithm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconstructionAccumulatorTest {

    @Test
    void negativeCoordinatesWrapAroundTheCanvas() {
        ReconstructionAccumulator accumulator = new ReconstructionAccumulator(4);

        accumulator.add(new RayPath(new int[]{-1, -1}, new int[]{-4, -3}), 5);

        assertThat(accumulator.sum(3, 0)).isEqualTo(5);
        assertThat(accumulator.sum(3, 1)).isEqualTo(5);
        assertThat(accumulator.hits(3, 0)).isEqualTo(1);
    }

    @Test
    void aPixelListedTwiceByOneRayIsUpdatedOnce() {
        ReconstructionAccumulator accumulator = new ReconstructionAccumulator(4);

        accumulator.add(new RayPath(new int[]{-4, -3, -2, -1, 0}, new int[]{0, 0, 0, 0, 0}), 2);
        accumulator.add(new RayPath(new int[]{0}, new int[]{0}), 3);

        assertThat(accumulator.sum(0, 0)).isEqualTo(5);
        assertThat(accumulator.hits(0, 0)).isEqualTo(2);
    }

    @Test
    void normalizeAveragesAndLeavesUntouchedPixelsAtZero() {
        ReconstructionAccumulator accumulator = new ReconstructionAccumulator(2);
        accumulator.add(new RayPath(new int[]{0, 1}, new int[]{0, 0}), 4);
        accumulator.add(new RayPath(new int[]{0}, new int[]{0}), 8);

        double[][] mean = accumulator.normalize();

        assertThat(mean).isDeepEqualTo(new double[][]{{6, 0}, {4, 0}});
    }

    @Test
    void mergeAddsSumsAndHits() {
        ReconstructionAccumulator a = new ReconstructionAccumulator(2);
        ReconstructionAccumulator b = new ReconstructionAccumulator(2);
        a.add(new RayPath(new int[]{1}, new int[]{1}), 1);
        b.add(new RayPath(new int[]{1}, new int[]{1}), 2);

        a.merge(b);

        assertThat(a.sum(1, 1)).isEqualTo(3);
        assertThat(a.hits(1, 1)).isEqualTo(2);
        assertThatThrownBy(() -> a.merge(new ReconstructionAccumulator(3)))
                .isInstanceOf(ShapeMismatchException.class);
    }
}
