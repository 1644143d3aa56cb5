package com.conveyal.velmap;

import com.conveyal.velmap.decomp.DecompositionMethod;
import com.conveyal.velmap.grid.DownsampleMethod;
import com.conveyal.velmap.merge.MergeMode;
import com.conveyal.velmap.merge.OffsetMethod;
import com.conveyal.velmap.reference.ReferenceMethod;

/**
 * Configuration with mutable fields for tests, so each test can change only the options it is about. Defaults
 * disable every optional stage.
 */
public class StubConfig implements DecompositionPipeline.Config {

    public boolean useMask = true;
    public int downsampleFactor = 0;
    public DownsampleMethod downsampleMethod = DownsampleMethod.MEAN;
    public MergeMode mergeAlongTrack = MergeMode.MERGE;
    public OffsetMethod mergeAlongTrackMethod = OffsetMethod.MEAN;
    public boolean mergeAcrossTrack = false;
    public double acrossTrackRefXMin = 0;
    public double acrossTrackRefXMax = 0;
    public double acrossTrackRefYMin = 0;
    public double acrossTrackRefYMax = 0;
    public ReferenceMethod referenceMethod = ReferenceMethod.NONE;
    public Integer referencePolyOrder = null;
    public Integer referenceFilterWindow = null;
    public boolean referenceUncertainty = false;
    public Double referenceNorthSigma = null;
    public DecompositionMethod decompositionMethod = DecompositionMethod.ZERO_NORTH;
    public double conditionThreshold = 0;
    public double varianceThreshold = 0;
    public int workerThreads = 0;

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
