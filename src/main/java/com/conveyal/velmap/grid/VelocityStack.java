package com.conveyal.velmap.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An ordered collection of layers (frames, merged tracks or track segments) all resampled onto the same grid.
 * The list of layers is fixed once the stack is built, but the contents of each layer may be corrected in place.
 */
public class VelocityStack {

    public final GridExtents extents;

    private final List<StackLayer> layers;

    public VelocityStack (GridExtents extents, List<StackLayer> layers) {
        this.extents = checkNotNull(extents);
        for (StackLayer layer : layers) {
            checkArgument(extents.equals(layer.extents), "Layer %s is not on the stack grid.", layer.id);
        }
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    public List<StackLayer> getLayers () {
        return layers;
    }

    public StackLayer get (int index) {
        return layers.get(index);
    }

    public StackLayer get (String id) {
        return layers.stream().filter(l -> l.id.equals(id)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No layer with id " + id));
    }

    public int size () {
        return layers.size();
    }

    public boolean isEmpty () {
        return layers.isEmpty();
    }

    public List<StackLayer> layersFor (PassDirection passDirection) {
        return layers.stream().filter(l -> l.passDirection == passDirection).collect(Collectors.toList());
    }

    public List<String> layerIds () {
        return layers.stream().map(l -> l.id).collect(Collectors.toList());
    }

    /** Deep copy, so that one stage's output survives in-place corrections by a later stage. */
    public VelocityStack copy () {
        return new VelocityStack(extents, layers.stream().map(StackLayer::copy).collect(Collectors.toList()));
    }

}
