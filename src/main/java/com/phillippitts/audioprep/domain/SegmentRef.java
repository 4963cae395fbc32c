package com.phillippitts.audioprep.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reference to a contiguous slice of one audio file; no samples are materialized.
 *
 * @param label      class label of the source file
 * @param source     audio file the slice belongs to
 * @param startFrame first frame of the slice (0-based)
 * @param frameCount number of frames in the slice
 */
public record SegmentRef(String label, Path source, long startFrame, int frameCount) {

    public SegmentRef {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (startFrame < 0) {
            throw new IllegalArgumentException("startFrame must be >= 0, got: " + startFrame);
        }
        if (frameCount <= 0) {
            throw new IllegalArgumentException("frameCount must be > 0, got: " + frameCount);
        }
    }

    /** Exclusive end frame of the slice. */
    public long endFrame() {
        return startFrame + frameCount;
    }

    @Override
    public String toString() {
        return label + "@" + source + ":" + startFrame + ":" + frameCount;
    }
}
