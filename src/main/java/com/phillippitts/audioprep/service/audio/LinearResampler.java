package com.phillippitts.audioprep.service.audio;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Linear interpolation resampler. Adequate for feature extraction where the mel filterbank
 * discards content above 7.5 kHz anyway.
 */
@Component
public class LinearResampler implements Resampler {

    @Override
    public float[] resample(float[] samples, double fromRate, double toRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: from="
                    + fromRate + ", to=" + toRate);
        }
        if (fromRate == toRate) {
            return samples.clone();
        }
        int n = samples.length;
        int outLength = (int) Math.floor(n * toRate / fromRate);
        float[] out = new float[outLength];
        double step = fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double pos = i * step;
            int idx = (int) pos;
            double frac = pos - idx;
            float s0 = samples[Math.min(idx, n - 1)];
            float s1 = samples[Math.min(idx + 1, n - 1)];
            out[i] = (float) (s0 + (s1 - s0) * frac);
        }
        return out;
    }
}
