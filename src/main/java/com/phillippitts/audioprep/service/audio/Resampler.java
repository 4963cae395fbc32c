package com.phillippitts.audioprep.service.audio;

/**
 * Converts a mono signal from one sample rate to another.
 */
public interface Resampler {

    /**
     * @param samples  mono input signal
     * @param fromRate input sample rate in Hz
     * @param toRate   output sample rate in Hz
     * @return resampled signal of length {@code floor(samples.length * toRate / fromRate)}
     */
    float[] resample(float[] samples, double fromRate, double toRate);
}
