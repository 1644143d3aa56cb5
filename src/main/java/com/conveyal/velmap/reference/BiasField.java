package com.conveyal.velmap.reference;

import com.conveyal.velmap.grid.StackLayer;

/**
 * A known systematic velocity (e.g. from a plate motion model) to be removed from every layer before referencing.
 * Implementations supply the bias already projected into the line of sight of a given layer.
 */
public interface BiasField {

    /**
     * @return the bias in the line of sight of the layer, as an [x][y] array on the layer's grid. NaN where the bias
     *         is unknown.
     */
    double[][] lineOfSightBias (StackLayer layer);

}
