package com.conveyal.velmap.decomp;

import com.conveyal.velmap.ConfigurationException;
import com.conveyal.velmap.StubConfig;
import com.conveyal.velmap.SyntheticScene;
import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.ReferenceField;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.WorkerPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

import static com.conveyal.velmap.SyntheticScene.SOUTH;
import static com.conveyal.velmap.SyntheticScene.WEST;
import static com.conveyal.velmap.SyntheticScene.extents;
import static com.conveyal.velmap.SyntheticScene.layer;
import static com.conveyal.velmap.SyntheticScene.lineOfSight;
import static com.conveyal.velmap.grid.PassDirection.ASCENDING;
import static com.conveyal.velmap.grid.PassDirection.DESCENDING;
import static com.conveyal.velmap.util.DataQualityWarning.Type.SINGULAR_PIXELS;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecomposerTest {

    private static final GridExtents EXTENTS = extents(6, 5);

    private static final DoubleBinaryOperator EAST = (x, y) -> 3 + 100 * (x - WEST);
    private static final DoubleBinaryOperator NORTH = (x, y) -> -4 + 50 * (y - SOUTH);
    private static final DoubleBinaryOperator UP = (x, y) -> -10 + 80 * (y - SOUTH);

    private final StubConfig config = new StubConfig();

    private final DataQualityReport report = new DataQualityReport();

    /** A layer over columns x0 to x1 observing the ground velocity, with or without its North component. */
    private static StackLayer observing (String id, double[] look, int x0, int x1, boolean withNorth, double sigma) {
        return layer(id, id, look[0] > 0 ? DESCENDING : ASCENDING, EXTENTS, x0, x1, 0,
                EXTENTS.height - 1, look, (x, y) -> lineOfSight(look, EAST.applyAsDouble(x, y),
                        withNorth ? NORTH.applyAsDouble(x, y) : 0, UP.applyAsDouble(x, y)), sigma);
    }

    private static VelocityStack ascendingAndDescending (boolean withNorth) {
        return new VelocityStack(EXTENTS, List.of(
                observing("073A", SyntheticScene.ASCENDING, 0, 5, withNorth, 1),
                observing("144D", SyntheticScene.DESCENDING, 0, 5, withNorth, 2)));
    }

    /** The true North as the reference field, with the given North uncertainty or none. */
    private static ReferenceField.Gridded reference (Double sigmaNorth) {
        double[][] east = EXTENTS.newArray(0);
        double[][] north = EXTENTS.newArray(0);
        for (int x = 0; x < EXTENTS.width; x++) {
            for (int y = 0; y < EXTENTS.height; y++) {
                east[x][y] = EAST.applyAsDouble(EXTENTS.x(x), EXTENTS.y(y));
                north[x][y] = NORTH.applyAsDouble(EXTENTS.x(x), EXTENTS.y(y));
            }
        }
        return sigmaNorth == null ? new ReferenceField.Gridded(EXTENTS, east, north, null, null)
                : new ReferenceField.Gridded(EXTENTS, east, north, EXTENTS.newArray(1), EXTENTS.newArray(sigmaNorth));
    }

    private DecompositionResult decompose (DecompositionMethod method, VelocityStack stack,
                                           ReferenceField.Gridded reference) {
        config.decompositionMethod = method;
        return new Decomposer(config, WorkerPool.inline()).decompose(stack, reference, report);
    }

    private static void assertRecovered (DecompositionResult result, double delta) {
        for (int x = 0; x < EXTENTS.width; x++) {
            for (int y = 0; y < EXTENTS.height; y++) {
                double qx = EXTENTS.x(x);
                double qy = EXTENTS.y(y);
                assertEquals(EAST.applyAsDouble(qx, qy), result.east[x][y], delta);
                assertEquals(UP.applyAsDouble(qx, qy), result.up[x][y], delta);
            }
        }
    }

    @Test
    void zeroNorthRecoversEastAndUp () {
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, ascendingAndDescending(false), null);

        assertRecovered(result, 1e-9);
        assertFalse(result.hasNorth());
        assertNull(result.varianceNorth);
        assertEquals(EXTENTS.cellCount(), result.countSolved());
        assertEquals(2, result.observationCount[3][3]);
        assertTrue(result.varianceEast[0][0] > 0);
        assertEquals(1.2539, result.conditionNumber[2][2], 1e-3);
        assertTrue(report.isEmpty());
    }

    @Test
    void zeroNorthVariancesFollowUncertainties () {
        // The two rows are mirror images in East, so each component is half the sum or difference of the two
        // observations divided by its direction cosine.
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, ascendingAndDescending(false), null);
        double[] a = SyntheticScene.ASCENDING;
        double sumOfVariances = 1 + 4;
        assertEquals(sumOfVariances / (4 * a[0] * a[0]), result.varianceEast[1][1], 1e-9);
        assertEquals(sumOfVariances / (4 * a[2] * a[2]), result.varianceUp[1][1], 1e-9);
    }

    @ParameterizedTest
    @EnumSource(value = DecompositionMethod.class, names = {"REMOVE_NORTH", "ESTIMATE_NORTH", "TWO_STAGE"})
    void methodsUsingReferenceNorthAreExact (DecompositionMethod method) {
        DecompositionResult result = decompose(method, ascendingAndDescending(true), reference(0.5));

        assertRecovered(result, 1e-8);
        assertTrue(result.hasNorth());
        double expectedNorth = NORTH.applyAsDouble(EXTENTS.x(4), EXTENTS.y(2));
        assertEquals(expectedNorth, result.north[4][2], 1e-8);
        assertTrue(result.varianceNorth[4][2] > 0);
        assertTrue(report.isEmpty());
    }

    @Test
    void estimatedNorthUsesConfiguredSigmaWithoutReferenceUncertainty () {
        config.referenceNorthSigma = 2.0;
        DecompositionResult result = decompose(DecompositionMethod.ESTIMATE_NORTH,
                ascendingAndDescending(true), reference(null));
        assertRecovered(result, 1e-8);
        // Both looks share their North and Up cosines, so the data cannot tighten the prior on North.
        assertEquals(4, result.varianceNorth[0][0], 1e-6);
    }

    @Test
    void estimatingNorthRequiresSomeNorthUncertainty () {
        assertThrows(ConfigurationException.class, () ->
                decompose(DecompositionMethod.ESTIMATE_NORTH, ascendingAndDescending(true), reference(null)));
    }

    @Test
    void removedNorthIsReported () {
        DecompositionResult result = decompose(DecompositionMethod.REMOVE_NORTH,
                ascendingAndDescending(true), reference(null));
        assertRecovered(result, 1e-9);
        // No uncertainty for the reference North was supplied.
        assertTrue(Double.isNaN(result.varianceNorth[1][1]));
    }

    @Test
    void pixelsSeenFromOneDirectionAreNotSolved () {
        VelocityStack stack = new VelocityStack(EXTENTS, List.of(
                observing("073A", SyntheticScene.ASCENDING, 0, 5, false, 1),
                observing("144D", SyntheticScene.DESCENDING, 2, 5, false, 1)));
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, stack, null);

        assertFalse(result.isSolved(1, 2));
        assertEquals(1, result.observationCount[1][2]);
        assertTrue(Double.isNaN(result.up[1][2]));
        assertFalse(result.illConditioned[1][2]);
        assertTrue(result.isSolved(2, 2));
        assertEquals(4 * EXTENTS.height, result.countSolved());
        // Lack of coverage is not a singular system.
        assertTrue(report.isEmpty());
    }

    @Test
    void noCoverageIsAConfigurationError () {
        VelocityStack stack = new VelocityStack(EXTENTS, List.of(
                observing("073A", SyntheticScene.ASCENDING, 0, 5, false, 1),
                observing("073B", SyntheticScene.ASCENDING, 0, 5, false, 1)));
        assertThrows(ConfigurationException.class,
                () -> decompose(DecompositionMethod.ZERO_NORTH, stack, null));
    }

    @Test
    void methodsUsingReferenceNorthRequireReference () {
        assertThrows(ConfigurationException.class,
                () -> decompose(DecompositionMethod.TWO_STAGE, ascendingAndDescending(true), null));
    }

    @Test
    void nearlyParallelLooksAreFlagged () {
        double[] steeper = SyntheticScene.lookVector(39.5, SyntheticScene.AZIMUTH_ASCENDING);
        VelocityStack stack = new VelocityStack(EXTENTS, List.of(
                observing("073A", SyntheticScene.ASCENDING, 0, 5, false, 1),
                observing("175A", steeper, 0, 5, false, 1)));
        config.conditionThreshold = 100;
        DecompositionResult flagged = decompose(DecompositionMethod.ZERO_NORTH, stack, null);
        assertTrue(flagged.illConditioned[2][3]);
        assertEquals(EXTENTS.cellCount(), flagged.countIllConditioned());
        // Flagged pixels keep their solution.
        assertTrue(flagged.isSolved(2, 3));
        assertEquals(229.9, flagged.conditionNumber[2][3], 0.1);

        config.conditionThreshold = 0;
        DecompositionResult unflagged = decompose(DecompositionMethod.ZERO_NORTH, stack, null);
        assertEquals(0, unflagged.countIllConditioned());
    }

    @Test
    void impreciseSolutionsAreFlagged () {
        VelocityStack stack = new VelocityStack(EXTENTS, List.of(
                observing("073A", SyntheticScene.ASCENDING, 0, 2, false, 10),
                observing("074A", SyntheticScene.ASCENDING, 3, 5, false, 0.1),
                observing("144D", SyntheticScene.DESCENDING, 0, 5, false, 0.1)));
        config.varianceThreshold = 1;
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, stack, null);
        assertTrue(result.highVariance[0][0]);
        assertEquals(3 * EXTENTS.height, result.countHighVariance());
        assertFalse(result.illConditioned[0][0]);
    }

    @Test
    void singularSystemsAreCountedOnce () {
        // Both looks have no East component, so East cannot be resolved without North.
        double[] north = {0, 1, 0};
        double[] oblique = {0, 0.6, 0.8};
        VelocityStack stack = new VelocityStack(EXTENTS, List.of(
                observing("001A", north, 0, 5, false, 1),
                observing("002A", oblique, 0, 5, false, 1)));
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, stack, null);

        assertEquals(0, result.countSolved());
        assertEquals(1, report.count(SINGULAR_PIXELS));
        assertTrue(report.getWarnings().get(0).message.startsWith(Integer.toString(EXTENTS.cellCount())));
    }

    @Test
    void pixelsWithoutReferenceNorthAreLeftUnsolved () {
        ReferenceField.Gridded reference = reference(null);
        reference.north[2][2] = Double.NaN;
        DecompositionResult result = decompose(DecompositionMethod.REMOVE_NORTH,
                ascendingAndDescending(true), reference);
        assertFalse(result.isSolved(2, 2));
        assertTrue(result.isSolved(2, 3));
        assertEquals(1, report.count(SINGULAR_PIXELS));
    }

    @Test
    void underflowingUncertaintyLeavesOnePixelUnsolved () {
        VelocityStack stack = ascendingAndDescending(false);
        // Squares to zero, so the observation carries no usable weight.
        stack.getLayers().get(1).uncertainty[2][2] = 1e-170;
        DecompositionResult result = decompose(DecompositionMethod.ZERO_NORTH, stack, null);

        assertFalse(result.isSolved(2, 2));
        assertTrue(result.isSolved(2, 3));
        assertEquals(EXTENTS.cellCount() - 1, result.countSolved());
        assertEquals(1, report.count(SINGULAR_PIXELS));
    }

    @Test
    void parallelDecompositionMatchesInline () {
        GridExtents wide = extents(40, 3);
        VelocityStack stack = new VelocityStack(wide, List.of(
                layer("073A", "073A", ASCENDING, wide, 0, 39, 0, 2, SyntheticScene.ASCENDING, EAST, 1),
                layer("144D", "144D", DESCENDING, wide, 5, 39, 0, 2, SyntheticScene.DESCENDING, UP, 1.5)));
        config.decompositionMethod = DecompositionMethod.ZERO_NORTH;
        DecompositionResult inline = new Decomposer(config, WorkerPool.inline()).decompose(stack, null, report);
        DecompositionResult parallel;
        try (WorkerPool workerPool = new WorkerPool(3)) {
            parallel = new Decomposer(config, workerPool).decompose(stack, null, report);
        }
        for (int x = 0; x < wide.width; x++) {
            assertArrayEquals(inline.east[x], parallel.east[x], 0);
            assertArrayEquals(inline.up[x], parallel.up[x], 0);
            assertArrayEquals(inline.varianceUp[x], parallel.varianceUp[x], 0);
        }
        assertEquals(35 * 3, parallel.countSolved());
    }

    @Test
    void rankDeficientSystemHasNoSolution () {
        PixelSystem system = new PixelSystem(2, 2);
        system.add(1, 1, 1, 0);
        system.add(2, 1, 2, 0);
        assertNull(system.solve());

        PixelSystem determined = new PixelSystem(2, 2);
        determined.add(1, 1, 1, 0);
        determined.add(2, 4, 0, 1);
        PixelSystem.Solution solution = determined.solve();
        assertNotNull(solution);
        assertArrayEquals(new double[] {1, 2}, solution.parameters, 1e-12);
        assertArrayEquals(new double[] {1, 4}, solution.variance, 1e-12);
    }

    @Test
    void observationsWithoutUsableWeightAreSkipped () {
        PixelSystem system = new PixelSystem(2, 4);
        assertFalse(system.add(1, 0, 1, 0));
        assertFalse(system.add(1, Double.MIN_VALUE, 1, 0));
        assertFalse(system.add(1, Double.NaN, 1, 0));
        assertTrue(system.add(1, 1, 1, 0));
        assertEquals(1, system.size());
        assertNull(system.solve());
    }

}
