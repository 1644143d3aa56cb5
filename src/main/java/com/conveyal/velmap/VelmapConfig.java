package com.conveyal.velmap;

import com.conveyal.velmap.decomp.DecompositionMethod;
import com.conveyal.velmap.grid.DownsampleMethod;
import com.conveyal.velmap.merge.MergeMode;
import com.conveyal.velmap.merge.OffsetMethod;
import com.conveyal.velmap.reference.ReferenceMethod;

import java.util.Properties;

/**
 * Loads the configuration of a velocity decomposition run and exposes it to the pipeline components through their
 * Config interfaces.
 */
public class VelmapConfig extends ConfigBase implements DecompositionPipeline.Config {

    // INSTANCE FIELDS

    private final boolean useMask;
    private final int downsampleFactor;
    private final DownsampleMethod downsampleMethod;
    private final MergeMode mergeAlongTrack;
    private final OffsetMethod mergeAlongTrackMethod;
    private final boolean mergeAcrossTrack;
    private final double acrossTrackRefXMin;
    private final double acrossTrackRefXMax;
    private final double acrossTrackRefYMin;
    private final double acrossTrackRefYMax;
    private final ReferenceMethod referenceMethod;
    private final Integer referencePolyOrder;
    private final Integer referenceFilterWindow;
    private final boolean referenceUncertainty;
    private final Double referenceNorthSigma;
    private final DecompositionMethod decompositionMethod;
    private final double conditionThreshold;
    private final double varianceThreshold;
    private final int workerThreads;

    // CONSTRUCTORS

    public VelmapConfig (Properties props) {
        super(props);
        useMask = boolProp("use-mask");
        downsampleFactor = intProp("downsample-factor");
        downsampleMethod = enumProp("downsample-method", DownsampleMethod.class);
        mergeAlongTrack = enumProp("merge-along-track", MergeMode.class);
        mergeAlongTrackMethod = enumProp("merge-along-track-method", OffsetMethod.class);
        mergeAcrossTrack = boolProp("merge-across-track");
        acrossTrackRefXMin = doubleProp("across-track-ref-xmin");
        acrossTrackRefXMax = doubleProp("across-track-ref-xmax");
        acrossTrackRefYMin = doubleProp("across-track-ref-ymin");
        acrossTrackRefYMax = doubleProp("across-track-ref-ymax");
        referenceMethod = enumProp("reference-method", ReferenceMethod.class);
        referencePolyOrder = optionalIntProp("reference-poly-order");
        referenceFilterWindow = optionalIntProp("reference-filter-window");
        referenceUncertainty = boolProp("reference-uncertainty");
        referenceNorthSigma = optionalDoubleProp("reference-north-sigma");
        decompositionMethod = enumProp("decomposition-method", DecompositionMethod.class);
        conditionThreshold = doubleProp("condition-threshold");
        varianceThreshold = doubleProp("variance-threshold");
        workerThreads = intProp("worker-threads");
        if (downsampleFactor < 0) keysWithErrors.add("downsample-factor");
        if (conditionThreshold < 0) keysWithErrors.add("condition-threshold");
        if (varianceThreshold < 0) keysWithErrors.add("variance-threshold");
        if (workerThreads < 0) keysWithErrors.add("worker-threads");
        exitIfErrors();
    }

    public static VelmapConfig fromFile (String filename) {
        return new VelmapConfig(propsFromFile(filename));
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing component Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public boolean useMask () { return useMask; }
    @Override public int downsampleFactor () { return downsampleFactor; }
    @Override public DownsampleMethod downsampleMethod () { return downsampleMethod; }
    @Override public MergeMode mergeAlongTrack () { return mergeAlongTrack; }
    @Override public OffsetMethod mergeAlongTrackMethod () { return mergeAlongTrackMethod; }
    @Override public boolean mergeAcrossTrack () { return mergeAcrossTrack; }
    @Override public double acrossTrackRefXMin () { return acrossTrackRefXMin; }
    @Override public double acrossTrackRefXMax () { return acrossTrackRefXMax; }
    @Override public double acrossTrackRefYMin () { return acrossTrackRefYMin; }
    @Override public double acrossTrackRefYMax () { return acrossTrackRefYMax; }
    @Override public ReferenceMethod referenceMethod () { return referenceMethod; }
    @Override public Integer referencePolyOrder () { return referencePolyOrder; }
    @Override public Integer referenceFilterWindow () { return referenceFilterWindow; }
    @Override public boolean referenceUncertainty () { return referenceUncertainty; }
    @Override public Double referenceNorthSigma () { return referenceNorthSigma; }
    @Override public DecompositionMethod decompositionMethod () { return decompositionMethod; }
    @Override public double conditionThreshold () { return conditionThreshold; }
    @Override public double varianceThreshold () { return varianceThreshold; }
    @Override public int workerThreads () { return workerThreads; }

}
