package com.conveyal.velmap.grid;

import org.junit.jupiter.api.Test;

import static com.conveyal.velmap.SyntheticScene.axis;
import static com.conveyal.velmap.SyntheticScene.raster;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RasterLayerTest {

    /** Geocoded rasters list latitude from north to south. Rows must be flipped along with the coordinates. */
    @Test
    void decreasingCoordinatesAreNormalized () {
        double[] x = {1, 2, 3};
        double[] y = {20, 10};
        double[][] rows = {
                {1, 2, 3},   // y = 20
                {4, 5, 6}    // y = 10
        };
        RasterLayer layer = RasterLayer.fromRows(x, y, rows);
        assertArrayEquals(new double[] {10, 20}, layer.y);
        assertEquals(4, layer.values[0][0]);
        assertEquals(1, layer.values[0][1]);
        assertEquals(6, layer.values[2][0]);
        assertEquals(10, layer.minY());
        assertEquals(20, layer.maxY());
    }

    @Test
    void nonMonotonicCoordinatesAreRejected () {
        double[] x = {1, 3, 2};
        double[] y = {1, 2};
        assertThrows(IllegalArgumentException.class, () -> new RasterLayer(x, y, new double[3][2]));
    }

    @Test
    void bilinearInterpolationIsExactForPlanes () {
        RasterLayer layer = raster(axis(0, 1, 5), axis(0, 2, 4), (x, y) -> 3 + 2 * x - y);
        assertEquals(3 + 2 * 1.25 - 3.3, layer.interpolate(1.25, 3.3), 1e-12);
        assertEquals(3 + 2 * 4 - 6, layer.interpolate(4, 6), 1e-12);
        assertTrue(Double.isNaN(layer.interpolate(4.5, 1)));
        assertTrue(Double.isNaN(layer.interpolate(1, -0.1)));
    }

    /** No-data in a neighboring node must not leak into a query falling exactly on a valid node. */
    @Test
    void nanNeighborsDoNotAffectNodeQueries () {
        double[][] values = {
                {1, 2, 3},
                {4, Double.NaN, 6},
                {7, 8, 9}
        };
        RasterLayer layer = new RasterLayer(new double[] {0, 1, 2}, new double[] {0, 1, 2}, values);
        assertEquals(1, layer.interpolate(0, 0));
        assertEquals(8, layer.interpolate(2, 1));
        assertEquals(9, layer.interpolate(2, 2));
        assertTrue(Double.isNaN(layer.interpolate(0.5, 0.5)));
        assertTrue(Double.isNaN(layer.interpolate(1, 1)));
    }

    @Test
    void downsampleWithPartialBlocks () {
        RasterLayer layer = raster(axis(0, 1, 5), axis(0, 1, 4), (x, y) -> x + 10 * y);
        layer.values[0][0] = Double.NaN;
        RasterLayer mean = layer.downsample(2, DownsampleMethod.MEAN);
        assertEquals(3, mean.width());
        assertEquals(2, mean.height());
        assertArrayEquals(new double[] {0.5, 2.5, 4}, mean.x, 1e-12);
        assertArrayEquals(new double[] {0.5, 2.5}, mean.y, 1e-12);
        // Block of (0,0) NaN, (1,0) = 1, (0,1) = 10, (1,1) = 11.
        assertEquals(22.0 / 3, mean.values[0][0], 1e-12);
        // Partial block of column 4, rows 2 and 3.
        assertEquals(29, mean.values[2][1], 1e-12);

        RasterLayer median = layer.downsample(2, DownsampleMethod.MEDIAN);
        assertEquals(10, median.values[0][0], 1e-12);
    }

    @Test
    void downsampleMustLeaveTwoCells () {
        RasterLayer layer = raster(axis(0, 1, 4), axis(0, 1, 4), (x, y) -> 1);
        assertThrows(IllegalArgumentException.class, () -> layer.downsample(4, DownsampleMethod.MEAN));
    }

}
