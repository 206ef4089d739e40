package com.example.tomograph.algorithm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SmoothingFilterTest {

    @Test
    void impulseSpreadsWithKernelWeights() {
        double[][] image = new double[5][5];
        image[2][2] = 23;

        double[][] out = SmoothingFilter.apply(image);

        assertThat(out[2][2]).isCloseTo(15, within(1e-4));
        assertThat(out[1][1]).isCloseTo(1, within(1e-5));
        assertThat(out[3][2]).isCloseTo(1, within(1e-5));
        assertThat(out[0][0]).isEqualTo(0);
    }

    @Test
    void bordersAreMirroredWithoutRepeatingTheEdge() {
        double[][] image = new double[3][3];
        image[1][1] = 23;

        double[][] out = SmoothingFilter.apply(image);

        // row -1 mirrors row 1 and column -1 mirrors column 1
        assertThat(out[0][0]).isCloseTo(4, within(1e-5));
        assertThat(out[0][1]).isCloseTo(2, within(1e-5));
    }

    @Test
    void productsAreSummedPairwiseInSinglePrecision() {
        double[][] image = {{68, 32, 130}, {60, 253, 230}, {241, 194, 107}};

        double[][] out = SmoothingFilter.apply(image);

        // a running sum gives 0x43532c86 here
        assertThat(out[1][1]).isEqualTo((double) Float.intBitsToFloat(0x43532c85));
    }

    @Test
    void constantImageIsUnchanged() {
        double[][] image = {{9, 9, 9, 9}, {9, 9, 9, 9}};

        double[][] out = SmoothingFilter.apply(image);

        for (double[] row : out) {
            assertThat(row).containsOnly(new double[]{9}, within(1e-4));
        }
    }
}
