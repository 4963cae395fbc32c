package com.phillippitts.audioprep.service.feature;

/**
 * Canonical log-mel feature constants.
 *
 * <p>Every feature example produced by the pipeline has shape
 * {@code (NUM_FRAMES, NUM_BANDS, 1)} regardless of the source file's format.
 */
public final class MelParams {

    private MelParams() {
        // Constants holder
    }

    /** Sample rate every segment is resampled to before analysis. */
    public static final int SAMPLE_RATE = 16_000;

    public static final double STFT_WINDOW_SECONDS = 0.025;
    public static final double STFT_HOP_SECONDS = 0.010;

    public static final int NUM_BANDS = 64;
    public static final double MEL_MIN_HZ = 125.0;
    public static final double MEL_MAX_HZ = 7500.0;

    /** Added to mel energies before taking the natural log. */
    public static final double LOG_OFFSET = 0.01;

    public static final double EXAMPLE_WINDOW_SECONDS = 4.96;
    public static final double EXAMPLE_HOP_SECONDS = 4.96;

    /** Spectrogram frames per example. */
    public static final int NUM_FRAMES = 496;

    /** STFT window length in samples (400). */
    public static final int STFT_WINDOW_SAMPLES = (int) Math.round(SAMPLE_RATE * STFT_WINDOW_SECONDS);

    /** STFT hop length in samples (160). */
    public static final int STFT_HOP_SAMPLES = (int) Math.round(SAMPLE_RATE * STFT_HOP_SECONDS);

    /** Next power of two at or above the STFT window length (512). */
    public static final int FFT_LENGTH = nextPowerOfTwo(STFT_WINDOW_SAMPLES);

    /** Magnitude bins kept from each FFT (257). */
    public static final int SPECTROGRAM_BINS = FFT_LENGTH / 2 + 1;

    public static final double FRAMES_PER_SECOND = 1.0 / STFT_HOP_SECONDS;

    public static final int EXAMPLE_WINDOW_FRAMES = (int) Math.round(EXAMPLE_WINDOW_SECONDS * FRAMES_PER_SECOND);
    public static final int EXAMPLE_HOP_FRAMES = (int) Math.round(EXAMPLE_HOP_SECONDS * FRAMES_PER_SECOND);

    /** Fewest samples at {@link #SAMPLE_RATE} that yield one full example (79600). */
    public static final int MIN_SAMPLES_PER_EXAMPLE =
            STFT_WINDOW_SAMPLES + (EXAMPLE_WINDOW_FRAMES - 1) * STFT_HOP_SAMPLES;

    static int nextPowerOfTwo(int n) {
        int p = 1;
        while (p < n) {
            p <<= 1;
        }
        return p;
    }
}
