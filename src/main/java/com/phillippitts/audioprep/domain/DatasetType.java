package com.phillippitts.audioprep.domain;

import com.phillippitts.audioprep.exception.InvalidDatasetTypeException;

import java.util.Locale;

/**
 * The three disjoint partitions produced by the stratified split.
 */
public enum DatasetType {
    TRAIN,
    VALIDATE,
    TEST;

    /** File extension of persisted feature artifacts. */
    public static final String FEATURES_EXTENSION = ".features";

    /**
     * Name of the feature artifact backing this split, e.g. {@code TRAIN.features}.
     */
    public String featuresFileName() {
        return name() + FEATURES_EXTENSION;
    }

    /**
     * Resolves a split by name, ignoring case.
     *
     * @param name split name such as "train" or "VALIDATE"
     * @return matching split
     * @throws InvalidDatasetTypeException if the name is null or unknown
     */
    public static DatasetType fromName(String name) {
        if (name == null) {
            throw new InvalidDatasetTypeException("null");
        }
        try {
            return DatasetType.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidDatasetTypeException(name);
        }
    }
}
