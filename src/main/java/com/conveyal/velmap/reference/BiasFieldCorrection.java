package com.conveyal.velmap.reference;

import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subtracts a BiasField from every layer of a stack, in place. Only valid cells are corrected. A valid cell where
 * the bias is unknown cannot be corrected and becomes masked.
 */
public class BiasFieldCorrection {

    private static final Logger LOG = LoggerFactory.getLogger(BiasFieldCorrection.class);

    private final BiasField biasField;

    public BiasFieldCorrection (BiasField biasField) {
        this.biasField = biasField;
    }

    public void apply (VelocityStack stack) {
        for (StackLayer layer : stack.getLayers()) {
            double[][] bias = biasField.lineOfSightBias(layer);
            int masked = 0;
            for (int x = 0; x < stack.extents.width; x++) {
                for (int y = 0; y < stack.extents.height; y++) {
                    if (!layer.isValue(x, y)) continue;
                    if (Double.isFinite(bias[x][y])) {
                        layer.velocity[x][y] -= bias[x][y];
                    } else {
                        layer.mask(x, y);
                        masked += 1;
                    }
                }
            }
            LOG.info("Removed bias field from {}, {} cells masked where the bias is unknown.", layer.id, masked);
        }
    }

}
