package com.phillippitts.audioprep.service.feature;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts a spectrogram into fixed-length windows along the time axis.
 */
@Component
public class SpectrogramFramer {

    /**
     * Produces {@code 1 + floor((n - window) / hop)} windows of {@code window} rows each, or none
     * when the spectrogram has fewer than {@code window} rows. Rows are copied.
     *
     * @param spectrogram matrix indexed {@code [frame][band]}
     * @param window      rows per window
     * @param hop         row stride between window starts
     */
    public List<float[][]> frame(float[][] spectrogram, int window, int hop) {
        Objects.requireNonNull(spectrogram, "spectrogram must not be null");
        if (window <= 0 || hop <= 0) {
            throw new IllegalArgumentException("window and hop must be positive: window="
                    + window + ", hop=" + hop);
        }
        int n = spectrogram.length;
        if (n < window) {
            return List.of();
        }
        int count = 1 + (n - window) / hop;
        List<float[][]> windows = new ArrayList<>(count);
        for (int w = 0; w < count; w++) {
            float[][] patch = new float[window][];
            int start = w * hop;
            for (int r = 0; r < window; r++) {
                patch[r] = spectrogram[start + r].clone();
            }
            windows.add(patch);
        }
        return windows;
    }
}
