package com.phillippitts.audioprep.domain;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * One model-ready log-mel example and its class label.
 *
 * <p>Logical shape is {@code (timeFrames, melBands, 1)}; the trailing channel dimension is
 * always 1 and is not stored. Instances are immutable: the patch is copied on the way in and on
 * the way out. Instances are compared by value.
 *
 * @param label  class label
 * @param values log-mel patch indexed {@code [frame][band]}
 */
public record FeatureExample(String label, float[][] values) implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Size of the trailing channel dimension. */
    public static final int CHANNELS = 1;

    public FeatureExample {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must have at least one frame");
        }
        int bands = values[0].length;
        for (float[] row : values) {
            if (row.length != bands) {
                throw new IllegalArgumentException("values must be rectangular");
            }
        }
        values = deepCopy(values);
    }

    /**
     * Creates an all-zero example of the given shape.
     */
    public static FeatureExample zeros(String label, int timeFrames, int melBands) {
        return new FeatureExample(label, new float[timeFrames][melBands]);
    }

    /**
     * Copy of the log-mel patch.
     */
    @Override
    public float[][] values() {
        return deepCopy(values);
    }

    public int timeFrames() {
        return values.length;
    }

    public int melBands() {
        return values[0].length;
    }

    /** Logical shape {@code [timeFrames, melBands, 1]}. */
    public int[] shape() {
        return new int[] {timeFrames(), melBands(), CHANNELS};
    }

    public float value(int frame, int band) {
        return values[frame][band];
    }

    public boolean isAllZero() {
        for (float[] row : values) {
            for (float v : row) {
                if (v != 0.0f) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns an example with the same feature values under a different label.
     */
    public FeatureExample withLabel(String newLabel) {
        return new FeatureExample(newLabel, values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureExample other)) {
            return false;
        }
        return label.equals(other.label) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + Arrays.deepHashCode(values);
    }

    private static float[][] deepCopy(float[][] source) {
        float[][] copy = new float[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return "FeatureExample{label=" + label + ", shape=" + Arrays.toString(shape()) + "}";
    }
}
