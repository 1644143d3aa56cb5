package com.conveyal.velmap.reference;

import com.conveyal.velmap.SyntheticScene;
import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.conveyal.velmap.SyntheticScene.axis;
import static com.conveyal.velmap.SyntheticScene.constant;
import static com.conveyal.velmap.SyntheticScene.extents;
import static com.conveyal.velmap.SyntheticScene.layer;
import static com.conveyal.velmap.grid.PassDirection.DESCENDING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BiasFieldCorrectionTest {

    private static final GridExtents EXTENTS = extents(6, 4);

    private static final double[] LOOK = SyntheticScene.DESCENDING;

    private static StackLayer observation () {
        return layer("144D", "144D", DESCENDING, EXTENTS, 1, 5, 0, 3, LOOK, (x, y) -> 10, 1);
    }

    @Test
    void horizontalBiasIsProjectedAndRemoved () {
        double[][] north = EXTENTS.newArray(2);
        north[3][2] = Double.NaN;
        EnuBiasField bias = new EnuBiasField(EXTENTS, EXTENTS.newArray(1), north, null);
        StackLayer layer = observation();
        new BiasFieldCorrection(bias).apply(new VelocityStack(EXTENTS, List.of(layer)));

        assertEquals(10 - LOOK[0] - 2 * LOOK[1], layer.velocity[2][1], 1e-12);
        // Cells outside the footprint stay no-data, cells with unknown bias become masked.
        assertTrue(Double.isNaN(layer.velocity[0][0]));
        assertTrue(layer.footprint[3][2]);
        assertTrue(Double.isNaN(layer.velocity[3][2]));
        assertTrue(Double.isNaN(layer.up[3][2]));
    }

    @Test
    void resampledBiasIncludesUp () {
        double[] x = axis(9.9, 0.1, 4);
        double[] y = axis(39.9, 0.1, 4);
        EnuBiasField bias = EnuBiasField.resample(EXTENTS, constant(x, y, 1), constant(x, y, 2), constant(x, y, 3));
        double[][] lineOfSight = bias.lineOfSightBias(observation());
        assertEquals(LOOK[0] + 2 * LOOK[1] + 3 * LOOK[2], lineOfSight[4][3], 1e-9);
    }

    @Test
    void biasMustShareTheGrid () {
        GridExtents other = extents(3, 3);
        EnuBiasField bias = new EnuBiasField(other, other.newArray(0), other.newArray(0), null);
        assertThrows(IllegalArgumentException.class, () -> bias.lineOfSightBias(observation()));
    }

}
