package com.conveyal.velmap;

import com.conveyal.velmap.decomp.DecompositionResult;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.merge.AcrossTrackMerger;
import com.conveyal.velmap.merge.AlongTrackMerger;
import com.conveyal.velmap.merge.OverlapCorrection;
import com.conveyal.velmap.merge.TrackSegment;
import com.conveyal.velmap.reference.ReferencingResult;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.DataQualityWarning;
import com.conveyal.velmap.util.JsonUtil;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outputs of every stage of one pipeline run, for export and inspection by external collaborators.
 */
public class PipelineResult {

    /** One layer per input frame on the common grid, as produced by grid unification. */
    public final VelocityStack unified;

    public final AlongTrackMerger.Result alongTrack;

    /** Null unless the diagnostic across-track merge was enabled. */
    public final AcrossTrackMerger.Result acrossTrack;

    /** Along-track output after bias removal and referencing, which is what was decomposed. */
    public final VelocityStack referenced;

    public final List<ReferencingResult> referencing;

    public final DecompositionResult decomposition;

    public final DataQualityReport report;

    public PipelineResult (VelocityStack unified, AlongTrackMerger.Result alongTrack,
                           AcrossTrackMerger.Result acrossTrack, VelocityStack referenced,
                           List<ReferencingResult> referencing, DecompositionResult decomposition,
                           DataQualityReport report) {
        this.unified = unified;
        this.alongTrack = alongTrack;
        this.acrossTrack = acrossTrack;
        this.referenced = referenced;
        this.referencing = referencing;
        this.decomposition = decomposition;
        this.report = report;
    }

    /** Write a JSON summary of the run, without any of the gridded values. */
    public void writeSummary (OutputStream outputStream) throws IOException {
        JsonUtil.objectMapper.writeValue(outputStream, new Summary(this));
    }

    /** Serializable overview of a run. */
    public static class Summary {

        public final String grid;
        public final List<String> frames;
        public final List<String> layers;
        public final List<TrackSegment> segments;
        public final List<OverlapCorrection> alongTrackCorrections;
        public final Map<String, Double> acrossTrackOffsets;
        public final List<String> referencedLayers = new ArrayList<>();
        public final Map<String, double[]> referencingCoefficients = new LinkedHashMap<>();
        public final String decompositionMethod;
        public final int solvedPixels;
        public final int illConditionedPixels;
        public final int highVariancePixels;
        public final List<DataQualityWarning> warnings;

        Summary (PipelineResult result) {
            grid = result.unified.extents.toString();
            frames = result.unified.layerIds();
            layers = result.alongTrack.layerIds();
            segments = result.alongTrack.segments;
            alongTrackCorrections = result.alongTrack.corrections;
            acrossTrackOffsets = result.acrossTrack == null ? null : result.acrossTrack.offsets;
            for (ReferencingResult referencing : result.referencing) {
                if (referencing.isReferenced()) {
                    referencedLayers.add(referencing.layerId);
                }
                if (referencing.surface != null) {
                    referencingCoefficients.put(referencing.layerId, referencing.surface.coefficients);
                }
            }
            decompositionMethod = result.decomposition.method.name();
            solvedPixels = result.decomposition.countSolved();
            illConditionedPixels = result.decomposition.countIllConditioned();
            highVariancePixels = result.decomposition.countHighVariance();
            warnings = result.report.getWarnings();
        }

    }

}
