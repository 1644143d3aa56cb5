package com.conveyal.velmap.surface;

import com.conveyal.velmap.grid.GridExtents;
import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A low-order 2D polynomial surface fitted to scattered samples by ordinary least squares. The terms are, in order,
 * 1, x, y for a first order surface and 1, x, y, xy, x², y² for a second order surface. Order zero is a constant.
 *
 * Coordinates may be shifted to a center point before fitting. Evaluation applies the same shift, so a fitted
 * surface can be evaluated directly at grid coordinates.
 */
public class SurfaceFit {

    /** Diagonal elements of R smaller than this make the least squares system singular. */
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    public final int order;

    public final double centerX;

    public final double centerY;

    public final double[] coefficients;

    public SurfaceFit (int order, double centerX, double centerY, double[] coefficients) {
        checkArgument(order >= 0 && order <= 2, "Only surfaces of order 0, 1 and 2 are supported, not %s.", order);
        checkArgument(coefficients.length == termCount(order), "A surface of order %s needs %s coefficients.",
                order, termCount(order));
        this.order = order;
        this.centerX = centerX;
        this.centerY = centerY;
        this.coefficients = coefficients.clone();
    }

    public static int termCount (int order) {
        switch (order) {
            case 0: return 1;
            case 1: return 3;
            case 2: return 6;
            default: throw new IllegalArgumentException("Unsupported surface order " + order);
        }
    }

    /**
     * Fit a surface to the given samples.
     * @param centered if true, coordinates are shifted to the midpoint of their range before fitting.
     * @throws SingularMatrixException if there are fewer samples than terms, or their layout cannot constrain the
     *         surface (e.g. all samples on one line for a planar fit).
     */
    public static SurfaceFit fit (int order, double[] xs, double[] ys, double[] values, boolean centered) {
        checkArgument(xs.length == ys.length && xs.length == values.length, "Sample arrays differ in length.");
        int nTerms = termCount(order);
        if (xs.length < nTerms) {
            throw new SingularMatrixException();
        }
        double cx = 0;
        double cy = 0;
        if (centered) {
            cx = midpoint(xs);
            cy = midpoint(ys);
        }
        RealMatrix design = new Array2DRowRealMatrix(xs.length, nTerms);
        for (int i = 0; i < xs.length; i++) {
            design.setRow(i, terms(order, xs[i] - cx, ys[i] - cy));
        }
        RealVector observed = new ArrayRealVector(values, false);
        RealVector solution = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver().solve(observed);
        return new SurfaceFit(order, cx, cy, solution.toArray());
    }

    /**
     * Fit a surface to every finite cell of an [x][y] array on the given grid.
     */
    public static SurfaceFit fitGrid (int order, GridExtents extents, double[][] values, boolean centered) {
        extents.checkShape(values);
        TDoubleArrayList xs = new TDoubleArrayList();
        TDoubleArrayList ys = new TDoubleArrayList();
        TDoubleArrayList vs = new TDoubleArrayList();
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (Double.isFinite(values[x][y])) {
                    xs.add(extents.x(x));
                    ys.add(extents.y(y));
                    vs.add(values[x][y]);
                }
            }
        }
        return fit(order, xs.toArray(), ys.toArray(), vs.toArray(), centered);
    }

    private static double midpoint (double[] coordinates) {
        double min = Arrays.stream(coordinates).min().orElse(0);
        double max = Arrays.stream(coordinates).max().orElse(0);
        return (min + max) / 2;
    }

    private static double[] terms (int order, double x, double y) {
        switch (order) {
            case 0: return new double[] {1};
            case 1: return new double[] {1, x, y};
            default: return new double[] {1, x, y, x * y, x * x, y * y};
        }
    }

    public double evaluate (double x, double y) {
        double[] t = terms(order, x - centerX, y - centerY);
        double sum = 0;
        for (int i = 0; i < t.length; i++) {
            sum += coefficients[i] * t[i];
        }
        return sum;
    }

    /** Evaluate the surface at every node of the grid. */
    public double[][] evaluate (GridExtents extents) {
        double[][] result = new double[extents.width][extents.height];
        for (int x = 0; x < extents.width; x++) {
            double qx = extents.x(x);
            for (int y = 0; y < extents.height; y++) {
                result[x][y] = evaluate(qx, extents.y(y));
            }
        }
        return result;
    }

    @Override
    public String toString () {
        return String.format("SurfaceFit[order=%d, center=(%s, %s), coefficients=%s]",
                order, centerX, centerY, Arrays.toString(coefficients));
    }

}
