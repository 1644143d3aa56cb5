package com.conveyal.velmap.grid;

import com.conveyal.velmap.util.NanStatistics;

/** How the cells of a block are aggregated when a raster is downsampled. NaN cells are ignored. */
public enum DownsampleMethod {

    MEAN, MEDIAN;

    public double aggregate (double[] block) {
        return this == MEDIAN ? NanStatistics.median(block) : NanStatistics.mean(block);
    }

}
