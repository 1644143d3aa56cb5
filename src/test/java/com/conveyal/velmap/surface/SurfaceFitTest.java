package com.conveyal.velmap.surface;

import com.conveyal.velmap.SyntheticScene;
import com.conveyal.velmap.grid.GridExtents;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SurfaceFitTest {

    private static final long SEED = 4321;

    @Test
    void recoversPlaneCoefficients () {
        Random random = new Random(SEED);
        int n = 50;
        double[] xs = new double[n];
        double[] ys = new double[n];
        double[] vs = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = 10 + random.nextDouble();
            ys[i] = 40 + random.nextDouble();
            vs[i] = 1.5 - 2 * xs[i] + 0.5 * ys[i];
        }
        SurfaceFit fit = SurfaceFit.fit(1, xs, ys, vs, false);
        assertArrayEquals(new double[] {1.5, -2, 0.5}, fit.coefficients, 1e-8);
        assertEquals(1.5 - 2 * 10.3 + 0.5 * 40.7, fit.evaluate(10.3, 40.7), 1e-9);
    }

    /** Centered fits report coefficients relative to the midpoint of the sample coordinates. */
    @Test
    void centeredQuadraticFit () {
        GridExtents extents = SyntheticScene.extents(20, 15);
        double cx = (extents.west + extents.east()) / 2;
        double cy = (extents.south + extents.north()) / 2;
        double[] expected = {0.3, 4, -2, 50, 20, -10};
        double[][] values = new double[extents.width][extents.height];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                double dx = extents.x(x) - cx;
                double dy = extents.y(y) - cy;
                values[x][y] = expected[0] + expected[1] * dx + expected[2] * dy + expected[3] * dx * dy
                        + expected[4] * dx * dx + expected[5] * dy * dy;
            }
        }
        values[4][4] = Double.NaN;
        SurfaceFit fit = SurfaceFit.fitGrid(2, extents, values, true);
        assertEquals(cx, fit.centerX, 1e-12);
        assertEquals(cy, fit.centerY, 1e-12);
        assertArrayEquals(expected, fit.coefficients, 1e-7);

        double[][] evaluated = fit.evaluate(extents);
        assertEquals(values[7][3], evaluated[7][3], 1e-10);
    }

    @Test
    void collinearSamplesAreSingular () {
        double[] xs = {1, 2, 3, 4};
        double[] ys = {2, 4, 6, 8};
        double[] vs = {1, 2, 3, 4};
        assertThrows(SingularMatrixException.class, () -> SurfaceFit.fit(1, xs, ys, vs, true));
    }

    @Test
    void tooFewSamplesAreSingular () {
        double[] xs = {1, 2, 3, 4, 5};
        double[] ys = {1, 3, 2, 5, 4};
        double[] vs = {1, 2, 3, 4, 5};
        assertThrows(SingularMatrixException.class, () -> SurfaceFit.fit(2, xs, ys, vs, false));
        assertThrows(SingularMatrixException.class,
                () -> SurfaceFit.fit(1, new double[0], new double[0], new double[0], false));
    }

    @Test
    void unsupportedOrder () {
        assertThrows(IllegalArgumentException.class, () -> new SurfaceFit(3, 0, 0, new double[10]));
        assertThrows(IllegalArgumentException.class, () -> new SurfaceFit(1, 0, 0, new double[2]));
    }

}
