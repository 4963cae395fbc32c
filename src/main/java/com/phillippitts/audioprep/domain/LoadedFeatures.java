package com.phillippitts.audioprep.domain;

import java.util.List;
import java.util.Objects;

/**
 * Features loaded back from a split artifact, after label filtering and remapping.
 * {@code labels.get(i)} is the label of {@code features.get(i)}.
 *
 * @param labels   labels in artifact order
 * @param features feature examples in artifact order
 */
public record LoadedFeatures(List<String> labels, List<FeatureExample> features) {

    public LoadedFeatures {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(features, "features must not be null");
        if (labels.size() != features.size()) {
            throw new IllegalArgumentException("labels and features must have the same size: "
                    + labels.size() + " != " + features.size());
        }
        labels = List.copyOf(labels);
        features = List.copyOf(features);
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }
}
