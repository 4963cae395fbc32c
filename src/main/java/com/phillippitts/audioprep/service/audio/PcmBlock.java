package com.phillippitts.audioprep.service.audio;

import java.util.Objects;

/**
 * Decoded PCM samples normalized to {@code [-1, 1]}, interleaved by channel.
 *
 * @param samples    interleaved samples, length is a multiple of {@code channels}
 * @param channels   number of channels
 * @param sampleRate frames per second
 */
public record PcmBlock(float[] samples, int channels, float sampleRate) {

    public PcmBlock {
        Objects.requireNonNull(samples, "samples must not be null");
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be > 0, got: " + channels);
        }
        if (samples.length % channels != 0) {
            throw new IllegalArgumentException("samples length " + samples.length
                    + " is not a multiple of channel count " + channels);
        }
    }

    public int frames() {
        return samples.length / channels;
    }

    /**
     * Averages the channels of each frame. A mono block is returned as a copy.
     */
    public float[] toMono() {
        int frames = frames();
        float[] mono = new float[frames];
        if (channels == 1) {
            System.arraycopy(samples, 0, mono, 0, frames);
            return mono;
        }
        for (int f = 0; f < frames; f++) {
            float sum = 0f;
            int base = f * channels;
            for (int c = 0; c < channels; c++) {
                sum += samples[base + c];
            }
            mono[f] = sum / channels;
        }
        return mono;
    }
}
