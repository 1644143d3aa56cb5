package com.conveyal.velmap.util;

import gnu.trove.iterator.TLongIntIterator;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.hash.TLongIntHashMap;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Summary statistics over samples that may contain NaN (no-data) values, which are ignored. All methods return NaN
 * when no finite sample remains.
 */
public abstract class NanStatistics {

    /** Continuous values are rounded to one decimal place (multiplied by this and rounded) before taking the mode. */
    public static final double MODE_SCALE = 10;

    public static double[] finiteValues (double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    public static double mean (double[] values) {
        double[] finite = finiteValues(values);
        return finite.length == 0 ? Double.NaN : StatUtils.mean(finite);
    }

    public static double median (double[] values) {
        double[] finite = finiteValues(values);
        return finite.length == 0 ? Double.NaN : new Median().evaluate(finite);
    }

    /**
     * The most frequent value after rounding every sample to one decimal place, halves away from zero. Ties are
     * broken in favor of the smallest value, so the result does not depend on iteration order of the underlying
     * hash map.
     */
    public static double mode (double[] values) {
        TLongIntMap counts = new TLongIntHashMap();
        for (double value : values) {
            if (Double.isFinite(value)) {
                counts.adjustOrPutValue(modeBin(value), 1, 1);
            }
        }
        if (counts.isEmpty()) {
            return Double.NaN;
        }
        long bestKey = 0;
        int bestCount = -1;
        for (TLongIntIterator it = counts.iterator(); it.hasNext(); ) {
            it.advance();
            if (it.value() > bestCount || (it.value() == bestCount && it.key() < bestKey)) {
                bestKey = it.key();
                bestCount = it.value();
            }
        }
        return bestKey / MODE_SCALE;
    }

    /** Index of the one-decimal bin of a value. FastMath.round would round negative halves towards zero. */
    static long modeBin (double value) {
        return (long) (FastMath.signum(value) * FastMath.floor(FastMath.abs(value) * MODE_SCALE + 0.5));
    }

    /** Mean over the finite values among the given candidates, used when averaging layers cell by cell. */
    public static double meanOfFinite (double... values) {
        checkArgument(values.length > 0);
        double sum = 0;
        int n = 0;
        for (double value : values) {
            if (Double.isFinite(value)) {
                sum += value;
                n += 1;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

}
