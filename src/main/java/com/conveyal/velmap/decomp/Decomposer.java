package com.conveyal.velmap.decomp;

import com.conveyal.velmap.ConfigurationException;
import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.ReferenceField;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.LambdaCounter;
import com.conveyal.velmap.util.WorkerPool;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

import static com.conveyal.velmap.util.DataQualityWarning.Type.SINGULAR_PIXELS;

/**
 * Recovers East and Up (and optionally North) ground velocities at every pixel of the grid from all line-of-sight
 * observations of that pixel, by weighted least squares with weights of 1/uncertainty².
 *
 * Only pixels observed from at least two non-parallel look directions are solved, all other pixels are left as
 * no-data. A pixel whose system turns out to be singular is also left as no-data and counted in one aggregated
 * warning. Poorly conditioned systems and imprecise solutions are kept but flagged in the result masks.
 *
 * Columns of the grid are solved in disjoint chunks on the worker pool. Each chunk writes only its own columns of the
 * result arrays.
 */
public class Decomposer {

    private static final Logger LOG = LoggerFactory.getLogger(Decomposer.class);

    /** Look vectors whose cross product is smaller than this are considered parallel. */
    static final double PARALLEL_TOLERANCE = 1e-9;

    /** Number of grid columns handed to a worker at once. */
    private static final int COLUMNS_PER_CHUNK = 16;

    public interface Config {
        DecompositionMethod decompositionMethod ();
        /** Condition numbers above this are flagged ill-conditioned, zero disables the check. */
        double conditionThreshold ();
        /** East or Up variances above this are flagged, zero disables the check. */
        double varianceThreshold ();
        /**
         * Uncertainty of the reference North velocity used where the reference field carries no uncertainties, or
         * null if unknown.
         */
        Double referenceNorthSigma ();
    }

    private final Config config;

    private final DecompositionMethod method;

    private final WorkerPool workerPool;

    public Decomposer (Config config, WorkerPool workerPool) {
        this.config = config;
        this.method = config.decompositionMethod();
        this.workerPool = workerPool;
    }

    /**
     * @param reference the reference field on the grid of the stack, or null if there is none.
     * @throws ConfigurationException if the method needs a reference field and none is given, or if no pixel
     *         anywhere is observed from two non-parallel look directions.
     */
    public DecompositionResult decompose (VelocityStack stack, ReferenceField.Gridded reference,
                                          DataQualityReport report) {
        if (method.requiresReference() && reference == null) {
            throw new ConfigurationException(String.format(
                    "Decomposition method %s requires a reference velocity field.", method));
        }
        if (method == DecompositionMethod.ESTIMATE_NORTH && config.referenceNorthSigma() == null
                && !reference.hasUncertainty()) {
            throw new ConfigurationException("Estimating North requires reference field uncertainties or a "
                    + "reference North sigma in the configuration.");
        }
        GridExtents extents = stack.extents;
        DecompositionResult result = new DecompositionResult(extents, method);

        boolean[][] covered = new boolean[extents.width][extents.height];
        int coveredCount = 0;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                List<StackLayer> observations = observationsAt(stack, x, y);
                result.observationCount[x][y] = observations.size();
                covered[x][y] = hasIndependentDirections(observations, x, y);
                if (covered[x][y]) coveredCount += 1;
            }
        }
        if (coveredCount == 0) {
            throw new ConfigurationException(
                    "No pixels with multiple look directions. Were frames from more than one track provided?");
        }
        LOG.info("Decomposing {} of {} pixels observed from multiple look directions using {}.",
                coveredCount, extents.cellCount(), method);

        LongAdder singular = new LongAdder();
        LambdaCounter counter = new LambdaCounter(LOG, extents.width, Math.max(1, extents.width / 10),
                "Decomposed {} of {} columns.");
        workerPool.forEachChunk(extents.width, COLUMNS_PER_CHUNK, (from, to) -> {
            for (int x = from; x < to; x++) {
                for (int y = 0; y < extents.height; y++) {
                    if (covered[x][y] && !solvePixel(stack, reference, result, x, y)) {
                        singular.increment();
                    }
                }
                counter.increment();
            }
        });
        counter.done();

        if (singular.sum() > 0) {
            report.warn(SINGULAR_PIXELS, "decomposition", String.format(
                    "%d pixels had singular or unsolvable systems and were left as no-data.", singular.sum()));
        }
        LOG.info("Decomposition complete: {} pixels solved, {} ill-conditioned, {} with high variance.",
                result.countSolved(), result.countIllConditioned(), result.countHighVariance());
        return result;
    }

    static List<StackLayer> observationsAt (VelocityStack stack, int x, int y) {
        List<StackLayer> observations = new ArrayList<>();
        for (StackLayer layer : stack.getLayers()) {
            if (layer.isCompleteObservation(x, y)) {
                observations.add(layer);
            }
        }
        return observations;
    }

    /** True if at least two of the observations look in non-parallel directions. */
    static boolean hasIndependentDirections (List<StackLayer> observations, int x, int y) {
        for (int i = 0; i < observations.size(); i++) {
            StackLayer a = observations.get(i);
            for (int j = i + 1; j < observations.size(); j++) {
                StackLayer b = observations.get(j);
                double cx = a.north[x][y] * b.up[x][y] - a.up[x][y] * b.north[x][y];
                double cy = a.up[x][y] * b.east[x][y] - a.east[x][y] * b.up[x][y];
                double cz = a.east[x][y] * b.north[x][y] - a.north[x][y] * b.east[x][y];
                if (FastMath.sqrt(cx * cx + cy * cy + cz * cz) > PARALLEL_TOLERANCE) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Build and solve the system of one pixel, writing the solution and its quality flags into the result.
     * @return false if the system could not be solved.
     */
    private boolean solvePixel (VelocityStack stack, ReferenceField.Gridded reference, DecompositionResult result,
                                int x, int y) {
        List<StackLayer> observations = observationsAt(stack, x, y);
        double referenceNorth = reference == null ? Double.NaN : reference.north[x][y];
        double sigmaNorth = northSigma(reference, x, y);
        if (method.requiresReference() && !Double.isFinite(referenceNorth)) {
            return false;
        }
        PixelSystem system;
        switch (method) {
            case ZERO_NORTH:
                system = new PixelSystem(2, observations.size());
                for (StackLayer obs : observations) {
                    system.add(obs.velocity[x][y], variance(obs, x, y), obs.east[x][y], obs.up[x][y]);
                }
                break;
            case REMOVE_NORTH:
                system = new PixelSystem(2, observations.size());
                for (StackLayer obs : observations) {
                    double n = obs.north[x][y];
                    double var = variance(obs, x, y);
                    if (Double.isFinite(sigmaNorth)) {
                        var += (n * sigmaNorth) * (n * sigmaNorth);
                    }
                    system.add(obs.velocity[x][y] - n * referenceNorth, var, obs.east[x][y], obs.up[x][y]);
                }
                break;
            case ESTIMATE_NORTH:
                if (!(sigmaNorth > 0)) {
                    return false;
                }
                system = new PixelSystem(3, observations.size() + 1);
                for (StackLayer obs : observations) {
                    system.add(obs.velocity[x][y], variance(obs, x, y), obs.east[x][y], obs.up[x][y], obs.north[x][y]);
                }
                system.add(referenceNorth, sigmaNorth * sigmaNorth, 0, 0, 1);
                break;
            default:
                return solveTwoStage(observations, referenceNorth, sigmaNorth, result, x, y);
        }
        PixelSystem.Solution solution = system.solve();
        if (solution == null) {
            return false;
        }
        double varEast = solution.variance[0];
        double varUp = solution.variance[1];
        result.east[x][y] = solution.parameters[0];
        result.up[x][y] = solution.parameters[1];
        result.varianceEast[x][y] = varEast;
        result.varianceUp[x][y] = varUp;
        if (method == DecompositionMethod.ESTIMATE_NORTH) {
            result.north[x][y] = solution.parameters[2];
            result.varianceNorth[x][y] = solution.variance[2];
        } else if (method == DecompositionMethod.REMOVE_NORTH) {
            result.north[x][y] = referenceNorth;
            result.varianceNorth[x][y] = sigmaNorth * sigmaNorth;
        }
        flag(result, x, y, system.conditionNumber(), varEast, varUp);
        return true;
    }

    /**
     * Solve for East and the combined component C = sin(β)·North + cos(β)·Up, where β = atan2(n, u) is the angle of
     * each look vector in the North-Up plane, then split C using the inverse-variance weighted mean β of the pixel
     * and the reference North.
     */
    private boolean solveTwoStage (List<StackLayer> observations, double referenceNorth, double sigmaNorth,
                                   DecompositionResult result, int x, int y) {
        PixelSystem system = new PixelSystem(2, observations.size());
        double betaSum = 0;
        double weightSum = 0;
        for (StackLayer obs : observations) {
            double n = obs.north[x][y];
            double u = obs.up[x][y];
            double var = variance(obs, x, y);
            if (system.add(obs.velocity[x][y], var, obs.east[x][y], FastMath.sqrt(n * n + u * u))) {
                betaSum += FastMath.atan2(n, u) / var;
                weightSum += 1 / var;
            }
        }
        PixelSystem.Solution solution = system.solve();
        if (solution == null) {
            return false;
        }
        double beta = betaSum / weightSum;
        double cosBeta = FastMath.cos(beta);
        double sinBeta = FastMath.sin(beta);
        if (FastMath.abs(cosBeta) < PARALLEL_TOLERANCE) {
            return false;
        }
        double combined = solution.parameters[1];
        double sigmaNorthSquared = Double.isFinite(sigmaNorth) ? sigmaNorth * sigmaNorth : 0;
        double varUp = (solution.variance[1] + sinBeta * sinBeta * sigmaNorthSquared) / (cosBeta * cosBeta);
        result.east[x][y] = solution.parameters[0];
        result.up[x][y] = (combined - sinBeta * referenceNorth) / cosBeta;
        result.north[x][y] = referenceNorth;
        result.varianceEast[x][y] = solution.variance[0];
        result.varianceUp[x][y] = varUp;
        result.varianceNorth[x][y] = Double.isFinite(sigmaNorth) ? sigmaNorthSquared : Double.NaN;
        flag(result, x, y, system.conditionNumber(), solution.variance[0], varUp);
        return true;
    }

    private void flag (DecompositionResult result, int x, int y, double conditionNumber,
                       double varEast, double varUp) {
        result.conditionNumber[x][y] = conditionNumber;
        double conditionThreshold = config.conditionThreshold();
        double varianceThreshold = config.varianceThreshold();
        result.illConditioned[x][y] = conditionThreshold > 0 && conditionNumber > conditionThreshold;
        result.highVariance[x][y] = varianceThreshold > 0 && Math.max(varEast, varUp) > varianceThreshold;
    }

    private static double variance (StackLayer obs, int x, int y) {
        double sigma = obs.uncertainty[x][y];
        return sigma * sigma;
    }

    /**
     * Uncertainty of the reference North at one pixel: from the reference field if it carries uncertainties, or
     * else the configured constant. NaN if neither is available.
     */
    private double northSigma (ReferenceField.Gridded reference, int x, int y) {
        if (reference != null && reference.hasUncertainty() && Double.isFinite(reference.sigmaNorth[x][y])) {
            return reference.sigmaNorth[x][y];
        }
        Double configured = config.referenceNorthSigma();
        return configured == null ? Double.NaN : configured;
    }

}
