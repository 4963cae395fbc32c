package com.phillippitts.audioprep.domain;

import java.util.Objects;

/**
 * Result of a stratified split: one {@link SampleCollection} per {@link DatasetType}.
 * For every label present, the three collections hold disjoint slices of that label's files.
 */
public record DatasetSplits(SampleCollection train, SampleCollection validate, SampleCollection test) {

    public DatasetSplits {
        Objects.requireNonNull(train, "train must not be null");
        Objects.requireNonNull(validate, "validate must not be null");
        Objects.requireNonNull(test, "test must not be null");
    }

    public static DatasetSplits empty() {
        return new DatasetSplits(new SampleCollection(), new SampleCollection(), new SampleCollection());
    }

    public SampleCollection get(DatasetType type) {
        return switch (type) {
            case TRAIN -> train;
            case VALIDATE -> validate;
            case TEST -> test;
        };
    }
}
