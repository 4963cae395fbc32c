package com.phillippitts.audioprep.service.encoding;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Fits label encodings and produces one-hot matrices.
 */
@Component
public class LabelEncoder {

    /**
     * Builds an encoding over the distinct classes, sorted lexicographically.
     *
     * @throws IllegalArgumentException if a class is null
     */
    public LabelEncoding fit(Collection<String> classes) {
        Objects.requireNonNull(classes, "classes must not be null");
        TreeSet<String> sorted = new TreeSet<>();
        for (String c : classes) {
            if (c == null) {
                throw new IllegalArgumentException("classes must not contain null");
            }
            sorted.add(c);
        }
        return new LabelEncoding(List.copyOf(sorted));
    }

    /**
     * One-hot encodes labels: row {@code i} has a single 1 at {@code encoding.idOf(labels[i])}.
     *
     * @return matrix of shape {@code [labels.size()][encoding.numClasses()]}
     * @throws IllegalArgumentException if a label is not in the encoding
     */
    public float[][] encode(List<String> labels, LabelEncoding encoding) {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(encoding, "encoding must not be null");
        int[] ids = encoding.transform(labels);
        float[][] oneHot = new float[ids.length][encoding.numClasses()];
        for (int i = 0; i < ids.length; i++) {
            oneHot[i][ids[i]] = 1.0f;
        }
        return oneHot;
    }
}
