package com.phillippitts.audioprep.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An audio file together with the class label derived from its folder.
 *
 * @param label sanitized, non-empty class label
 * @param path  path to the audio file
 */
public record LabeledFile(String label, Path path) {

    public LabeledFile {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (label.isEmpty()) {
            throw new IllegalArgumentException("label must not be empty");
        }
    }
}
