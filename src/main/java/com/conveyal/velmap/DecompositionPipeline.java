package com.conveyal.velmap;

import com.conveyal.velmap.decomp.Decomposer;
import com.conveyal.velmap.decomp.DecompositionResult;
import com.conveyal.velmap.grid.Frame;
import com.conveyal.velmap.grid.GridUnifier;
import com.conveyal.velmap.grid.ReferenceField;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.merge.AcrossTrackMerger;
import com.conveyal.velmap.merge.AlongTrackMerger;
import com.conveyal.velmap.merge.MergeMode;
import com.conveyal.velmap.reference.BiasField;
import com.conveyal.velmap.reference.BiasFieldCorrection;
import com.conveyal.velmap.reference.GnssReferencer;
import com.conveyal.velmap.reference.ReferenceMethod;
import com.conveyal.velmap.reference.ReferencingResult;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Runs all stages of a velocity decomposition in order: grid unification, along-track merging, the optional
 * diagnostic across-track merge, removal of an optional bias field, referencing to the reference velocity field and
 * finally the per-pixel decomposition.
 *
 * Each stage works on its own copy of the stack, so the output of every stage is available in the result.
 */
public class DecompositionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DecompositionPipeline.class);

    public interface Config extends GridUnifier.Config, AlongTrackMerger.Config, AcrossTrackMerger.Config,
            GnssReferencer.Config, Decomposer.Config, WorkerPool.Config {
        boolean mergeAcrossTrack ();
        /** Whether uncertainties of the reference field are resampled and propagated into the decomposition. */
        boolean referenceUncertainty ();
    }

    private final Config config;

    /**
     * @throws ConfigurationException if the combination of options cannot work.
     */
    public DecompositionPipeline (Config config) {
        this.config = config;
        if (config.mergeAcrossTrack() && config.mergeAlongTrack() != MergeMode.MERGE) {
            throw new ConfigurationException("Across-track merging operates on merged tracks and requires frames "
                    + "to be merged along track.");
        }
    }

    /**
     * @param frames the input frames, at least one.
     * @param reference the reference velocity field, or null. Required by referencing and by decomposition methods
     *                  that use the reference North velocity.
     * @param biasField a bias to remove before referencing, or null.
     */
    public PipelineResult run (List<Frame> frames, ReferenceField reference, BiasField biasField) {
        DataQualityReport report = new DataQualityReport();
        try (WorkerPool workerPool = new WorkerPool(config)) {
            // Construct components first so configuration problems surface before any processing.
            GridUnifier unifier = new GridUnifier(config, workerPool);
            AlongTrackMerger alongTrackMerger = new AlongTrackMerger(config, workerPool);
            GnssReferencer referencer = config.referenceMethod() == ReferenceMethod.NONE
                    ? null : new GnssReferencer(config, workerPool);
            Decomposer decomposer = new Decomposer(config, workerPool);
            if (reference == null && (referencer != null || config.decompositionMethod().requiresReference())) {
                throw new ConfigurationException(String.format(
                        "A reference velocity field is required for referencing method %s and decomposition " +
                        "method %s.", config.referenceMethod(), config.decompositionMethod()));
            }

            VelocityStack unified = unifier.unify(frames, report);
            ReferenceField.Gridded griddedReference = reference == null
                    ? null : reference.resample(unified.extents, config.referenceUncertainty());

            AlongTrackMerger.Result alongTrack = alongTrackMerger.merge(unified, report);

            AcrossTrackMerger.Result acrossTrack = null;
            if (config.mergeAcrossTrack()) {
                acrossTrack = new AcrossTrackMerger(config).merge(alongTrack.stack, report);
            }

            VelocityStack referenced = alongTrack.stack.copy();
            if (biasField != null) {
                new BiasFieldCorrection(biasField).apply(referenced);
            }
            List<ReferencingResult> referencing = Collections.emptyList();
            if (referencer != null) {
                referencing = referencer.reference(referenced, griddedReference, report);
            }

            DecompositionResult decomposition = decomposer.decompose(referenced, griddedReference, report);
            LOG.info("Pipeline complete with {} data quality warnings.", report.getWarnings().size());
            return new PipelineResult(unified, alongTrack, acrossTrack, referenced, referencing,
                    decomposition, report);
        }
    }

}
