package com.example.tomograph.algorithm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineRasterizerTest {

    @Test
    void shallowLineRoundsHalvesToEven() {
        RayPath path = LineRasterizer.trace(0, 0, 4, 2);

        assertThat(path.xs()).containsExactly(0, 1, 2, 3, 4);
        assertThat(path.ys()).containsExactly(0, 0, 1, 2, 2);
    }

    @Test
    void stepsBackwardsWhenTheEndIsBeforeTheStart() {
        RayPath path = LineRasterizer.trace(4, 2, 0, 0);

        assertThat(path.xs()).containsExactly(4, 3, 2, 1, 0);
        assertThat(path.ys()).containsExactly(2, 2, 1, 0, 0);
    }

    @Test
    void steepLineStepsAlongY() {
        RayPath path = LineRasterizer.trace(0, 0, 1, 3);

        assertThat(path.xs()).containsExactly(0, 0, 1, 1);
        assertThat(path.ys()).containsExactly(0, 1, 2, 3);
    }

    @Test
    void verticalAndDegenerateLines() {
        RayPath vertical = LineRasterizer.trace(-3, -6, -3, 0);
        assertThat(vertical.xs()).containsOnly(-3);
        assertThat(vertical.ys()).containsExactly(-6, -5, -4, -3, -2, -1, 0);

        RayPath point = LineRasterizer.trace(-3, 0, -3, 0);
        assertThat(point.length()).isEqualTo(1);
        assertThat(point.x(0)).isEqualTo(-3);
        assertThat(point.y(0)).isEqualTo(0);
    }

    @Test
    void pathLengthFollowsTheLongerAxis() {
        int[][] ends = {{-10, -2, -1, -7}, {0, 0, -5, -12}, {-20, -20, 0, 0}, {-8, -1, -8, -9}};
        for (int[] e : ends) {
            RayPath path = LineRasterizer.trace(e[0], e[1], e[2], e[3]);
            int expected = Math.max(Math.abs(e[2] - e[0]), Math.abs(e[3] - e[1])) + 1;
            assertThat(path.length()).isEqualTo(expected);
            assertThat(path.x(0)).isEqualTo(e[0]);
            assertThat(path.y(0)).isEqualTo(e[1]);
            assertThat(path.x(path.length() - 1)).isEqualTo(e[2]);
            assertThat(path.y(path.length() - 1)).isEqualTo(e[3]);
        }
    }
}
