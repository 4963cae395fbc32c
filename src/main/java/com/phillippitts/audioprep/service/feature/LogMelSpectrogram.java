package com.phillippitts.audioprep.service.feature;

import org.jtransforms.fft.DoubleFFT_1D;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Log-scaled mel spectrogram of a 16 kHz mono signal.
 *
 * <p>Pipeline per frame: periodic Hann window, zero-padded real FFT, magnitude, HTK mel
 * filterbank, then {@code log(mel + LOG_OFFSET)}. Window and filterbank are computed once and
 * shared. Each {@link #compute(float[])} call uses its own JTransforms plan, so instances are
 * thread-safe.
 */
@Component
public class LogMelSpectrogram {

    private static final double HTK_MEL_BREAK_HZ = 700.0;
    private static final double HTK_MEL_HIGH_Q = 1127.0;

    private final int windowLength;
    private final int hopLength;
    private final int fftLength;
    private final int numBands;
    private final double logOffset;

    private final double[] window;
    private final double[][] melWeights;

    public LogMelSpectrogram() {
        this(MelParams.SAMPLE_RATE, MelParams.STFT_WINDOW_SAMPLES, MelParams.STFT_HOP_SAMPLES,
                MelParams.FFT_LENGTH, MelParams.NUM_BANDS, MelParams.MEL_MIN_HZ, MelParams.MEL_MAX_HZ,
                MelParams.LOG_OFFSET);
    }

    LogMelSpectrogram(int sampleRate, int windowLength, int hopLength, int fftLength, int numBands,
                      double lowerEdgeHz, double upperEdgeHz, double logOffset) {
        if (Integer.bitCount(fftLength) != 1 || fftLength < windowLength) {
            throw new IllegalArgumentException("fftLength must be a power of two >= windowLength, got: "
                    + fftLength);
        }
        if (lowerEdgeHz < 0 || lowerEdgeHz >= upperEdgeHz || upperEdgeHz > sampleRate / 2.0) {
            throw new IllegalArgumentException("Invalid mel edges: lower=" + lowerEdgeHz
                    + ", upper=" + upperEdgeHz + ", nyquist=" + sampleRate / 2.0);
        }
        this.windowLength = windowLength;
        this.hopLength = hopLength;
        this.fftLength = fftLength;
        this.numBands = numBands;
        this.logOffset = logOffset;
        this.window = periodicHann(windowLength);
        this.melWeights = melWeightMatrix(numBands, fftLength / 2 + 1, sampleRate, lowerEdgeHz, upperEdgeHz);
    }

    /**
     * Number of STFT frames produced for a signal of {@code numSamples} samples.
     */
    public int frameCount(int numSamples) {
        if (numSamples < windowLength) {
            return 0;
        }
        return 1 + (numSamples - windowLength) / hopLength;
    }

    /**
     * Computes the log-mel spectrogram.
     *
     * @param samples mono signal at the configured sample rate
     * @return matrix indexed {@code [frame][band]}; zero rows when the signal is shorter than one window
     */
    public float[][] compute(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        int frames = frameCount(samples.length);
        float[][] out = new float[frames][numBands];
        int bins = fftLength / 2 + 1;
        DoubleFFT_1D fft = new DoubleFFT_1D(fftLength);
        double[] buffer = new double[fftLength];
        double[] magnitude = new double[bins];

        for (int f = 0; f < frames; f++) {
            int start = f * hopLength;
            for (int i = 0; i < fftLength; i++) {
                buffer[i] = i < windowLength ? samples[start + i] * window[i] : 0.0;
            }
            fft.realForward(buffer);
            packedMagnitudes(buffer, magnitude);
            for (int m = 0; m < numBands; m++) {
                double energy = 0.0;
                for (int k = 0; k < bins; k++) {
                    energy += magnitude[k] * melWeights[k][m];
                }
                out[f][m] = (float) Math.log(energy + logOffset);
            }
        }
        return out;
    }

    static double hertzToMel(double hz) {
        return HTK_MEL_HIGH_Q * Math.log(1.0 + hz / HTK_MEL_BREAK_HZ);
    }

    /**
     * "Periodic" Hann window: {@code 0.5 - 0.5 cos(2 pi i / N)}.
     */
    static double[] periodicHann(int length) {
        double[] w = new double[length];
        for (int i = 0; i < length; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / length);
        }
        return w;
    }

    /**
     * Triangular weights mapping linear FFT bins to mel bands, indexed {@code [bin][band]}.
     * Bands are spaced uniformly on the mel scale between the edges; the DC bin carries no weight.
     */
    static double[][] melWeightMatrix(int numBands, int numBins, int sampleRate,
                                      double lowerEdgeHz, double upperEdgeHz) {
        double nyquist = sampleRate / 2.0;
        double[] binsMel = new double[numBins];
        for (int k = 0; k < numBins; k++) {
            binsMel[k] = hertzToMel(nyquist * k / (numBins - 1));
        }
        double lowerMel = hertzToMel(lowerEdgeHz);
        double upperMel = hertzToMel(upperEdgeHz);
        double[] edges = new double[numBands + 2];
        for (int i = 0; i < edges.length; i++) {
            edges[i] = lowerMel + (upperMel - lowerMel) * i / (numBands + 1);
        }

        double[][] weights = new double[numBins][numBands];
        for (int m = 0; m < numBands; m++) {
            double lower = edges[m];
            double center = edges[m + 1];
            double upper = edges[m + 2];
            for (int k = 1; k < numBins; k++) {
                double lowerSlope = (binsMel[k] - lower) / (center - lower);
                double upperSlope = (upper - binsMel[k]) / (upper - center);
                weights[k][m] = Math.max(0.0, Math.min(lowerSlope, upperSlope));
            }
        }
        return weights;
    }

    /**
     * Magnitudes of the {@code n / 2 + 1} non-negative frequency bins from JTransforms' packed
     * {@code realForward} layout: {@code a[0] = Re[0]}, {@code a[1] = Re[n/2]},
     * {@code a[2k], a[2k+1] = Re[k], Im[k]}.
     */
    static void packedMagnitudes(double[] packed, double[] magnitude) {
        int half = packed.length / 2;
        magnitude[0] = Math.abs(packed[0]);
        magnitude[half] = Math.abs(packed[1]);
        for (int k = 1; k < half; k++) {
            magnitude[k] = Math.hypot(packed[2 * k], packed[2 * k + 1]);
        }
    }
}
