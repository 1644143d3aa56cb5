package com.conveyal.velmap.decomp;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The weighted least squares system of one pixel: one row of the design matrix G per observation, with the
 * observed value and its variance. Solving minimizes the sum of squared residuals weighted by inverse variance,
 * m = (GᵗWG)⁻¹GᵗWd, through a singular value decomposition of the whitened system.
 */
class PixelSystem {

    final int unknowns;

    private final double[][] design;

    private final double[] observed;

    private final double[] variance;

    private int size = 0;

    PixelSystem (int unknowns, int capacity) {
        this.unknowns = unknowns;
        this.design = new double[capacity][];
        this.observed = new double[capacity];
        this.variance = new double[capacity];
    }

    /**
     * Add one observation. An observation whose variance cannot serve as a weight, because it is not positive, not
     * finite or so small its inverse overflows, is skipped.
     * @return whether the observation was added.
     */
    boolean add (double observation, double observationVariance, double... coefficients) {
        checkArgument(coefficients.length == unknowns);
        if (!isUsableVariance(observationVariance)) {
            return false;
        }
        design[size] = coefficients;
        observed[size] = observation;
        variance[size] = observationVariance;
        size += 1;
        return true;
    }

    static boolean isUsableVariance (double variance) {
        return variance > 0 && Double.isFinite(variance) && Double.isFinite(1 / variance);
    }

    int size () {
        return size;
    }

    /** Ratio of the largest to the smallest singular value of the unweighted design matrix. */
    double conditionNumber () {
        return new SingularValueDecomposition(designMatrix(false)).getConditionNumber();
    }

    /**
     * @return the solution with the diagonal of its covariance matrix, or null if the system is rank deficient.
     */
    Solution solve () {
        if (size < unknowns) {
            return null;
        }
        SingularValueDecomposition svd = new SingularValueDecomposition(designMatrix(true));
        if (svd.getRank() < unknowns) {
            return null;
        }
        double[] whitened = new double[size];
        for (int i = 0; i < size; i++) {
            whitened[i] = observed[i] / Math.sqrt(variance[i]);
        }
        double[] parameters = svd.getSolver().solve(new ArrayRealVector(whitened, false)).toArray();
        RealMatrix covariance = svd.getCovariance(0);
        double[] parameterVariance = new double[unknowns];
        for (int j = 0; j < unknowns; j++) {
            parameterVariance[j] = covariance.getEntry(j, j);
        }
        return new Solution(parameters, parameterVariance);
    }

    /** The design matrix, optionally with each row scaled by the inverse standard deviation of its observation. */
    private RealMatrix designMatrix (boolean weighted) {
        RealMatrix matrix = new Array2DRowRealMatrix(size, unknowns);
        for (int i = 0; i < size; i++) {
            double scale = weighted ? 1 / Math.sqrt(variance[i]) : 1;
            for (int j = 0; j < unknowns; j++) {
                matrix.setEntry(i, j, design[i][j] * scale);
            }
        }
        return matrix;
    }

    static class Solution {

        final double[] parameters;

        final double[] variance;

        Solution (double[] parameters, double[] variance) {
            this.parameters = parameters;
            this.variance = variance;
        }

    }

}
