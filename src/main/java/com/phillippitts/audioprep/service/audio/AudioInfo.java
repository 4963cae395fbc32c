package com.phillippitts.audioprep.service.audio;

/**
 * Header-level facts about an audio file.
 *
 * @param sampleRate frames per second
 * @param frameCount total number of frames in the file
 * @param channels   number of interleaved channels
 */
public record AudioInfo(float sampleRate, long frameCount, int channels) {

    public AudioInfo {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must be >= 0, got: " + frameCount);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be > 0, got: " + channels);
        }
    }

    public double durationSeconds() {
        return frameCount / (double) sampleRate;
    }
}
