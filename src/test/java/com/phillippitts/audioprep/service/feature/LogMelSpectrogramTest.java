package com.phillippitts.audioprep.service.feature;

import org.jtransforms.fft.DoubleFFT_1D;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LogMelSpectrogramTest {

    private final LogMelSpectrogram spectrogram = new LogMelSpectrogram();

    @Test
    void frameCountFollowsWindowAndHop() {
        assertThat(spectrogram.frameCount(399)).isZero();
        assertThat(spectrogram.frameCount(400)).isEqualTo(1);
        assertThat(spectrogram.frameCount(559)).isEqualTo(1);
        assertThat(spectrogram.frameCount(560)).isEqualTo(2);
        assertThat(spectrogram.frameCount(MelParams.MIN_SAMPLES_PER_EXAMPLE)).isEqualTo(MelParams.NUM_FRAMES);
        assertThat(spectrogram.frameCount(80_000)).isEqualTo(498);
    }

    @Test
    void shortSignalProducesNoFrames() {
        assertThat(spectrogram.compute(new float[399])).isEmpty();
    }

    @Test
    void silenceMapsToLogOfOffset() {
        float[][] out = spectrogram.compute(new float[1_000]);

        assertThat(out).hasNumberOfRows(spectrogram.frameCount(1_000));
        for (float[] row : out) {
            assertThat(row).hasSize(MelParams.NUM_BANDS);
            for (float v : row) {
                assertThat(v).isCloseTo((float) Math.log(MelParams.LOG_OFFSET), within(1e-6f));
            }
        }
    }

    @Test
    void toneEnergyPeaksInBandCoveringItsFrequency() {
        double hz = 1_000.0;
        float[] tone = new float[4_000];
        for (int i = 0; i < tone.length; i++) {
            tone[i] = (float) (0.5 * Math.sin(2 * Math.PI * hz * i / MelParams.SAMPLE_RATE));
        }

        float[][] out = spectrogram.compute(tone);

        int peak = argmax(out[0]);
        int expected = nearestBandCenter(hz);
        assertThat(Math.abs(peak - expected)).isLessThanOrEqualTo(1);
        assertThat(out[0][peak]).isGreaterThan((float) Math.log(MelParams.LOG_OFFSET) + 1f);
    }

    @Test
    void packedMagnitudesRecoverCosineAtItsBin() {
        int n = MelParams.FFT_LENGTH;
        double[] signal = new double[n];
        for (int i = 0; i < n; i++) {
            signal[i] = 1.0 + Math.cos(2.0 * Math.PI * 32 * i / n) + 0.5 * Math.cos(Math.PI * i);
        }
        new DoubleFFT_1D(n).realForward(signal);
        double[] magnitude = new double[n / 2 + 1];

        LogMelSpectrogram.packedMagnitudes(signal, magnitude);

        assertThat(magnitude[0]).isCloseTo(n, within(1e-9));
        assertThat(magnitude[32]).isCloseTo(n / 2.0, within(1e-9));
        assertThat(magnitude[n / 2]).isCloseTo(n / 2.0, within(1e-9));
        assertThat(magnitude[31]).isCloseTo(0.0, within(1e-9));
        assertThat(magnitude[100]).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void melWeightsAreTriangularAndIgnoreDc() {
        double[][] weights = LogMelSpectrogram.melWeightMatrix(MelParams.NUM_BANDS, MelParams.SPECTROGRAM_BINS,
                MelParams.SAMPLE_RATE, MelParams.MEL_MIN_HZ, MelParams.MEL_MAX_HZ);

        assertThat(weights).hasNumberOfRows(257);
        assertThat(weights[0]).containsOnly(0.0);
        for (int m = 0; m < MelParams.NUM_BANDS; m++) {
            double max = 0;
            for (double[] row : weights) {
                assertThat(row[m]).isBetween(0.0, 1.0);
                max = Math.max(max, row[m]);
            }
            assertThat(max).as("band %d has weight", m).isGreaterThan(0.0);
        }
    }

    @Test
    void usesHtkMelScale() {
        assertThat(LogMelSpectrogram.hertzToMel(0)).isZero();
        assertThat(LogMelSpectrogram.hertzToMel(700)).isCloseTo(1127 * Math.log(2), within(1e-9));
    }

    @Test
    void hannWindowIsPeriodic() {
        double[] w = LogMelSpectrogram.periodicHann(400);

        assertThat(w[0]).isZero();
        assertThat(w[200]).isCloseTo(1.0, within(1e-12));
        assertThat(w[1]).isCloseTo(w[399], within(1e-12));
    }

    @Test
    void rejectsInvalidGeometry() {
        assertThatThrownBy(() -> new LogMelSpectrogram(16_000, 400, 160, 500, 64, 125, 7500, 0.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LogMelSpectrogram(16_000, 400, 160, 512, 64, 125, 9000, 0.01))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static int argmax(float[] row) {
        int best = 0;
        for (int i = 1; i < row.length; i++) {
            if (row[i] > row[best]) {
                best = i;
            }
        }
        return best;
    }

    private static int nearestBandCenter(double hz) {
        double lower = LogMelSpectrogram.hertzToMel(MelParams.MEL_MIN_HZ);
        double upper = LogMelSpectrogram.hertzToMel(MelParams.MEL_MAX_HZ);
        double target = LogMelSpectrogram.hertzToMel(hz);
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int m = 0; m < MelParams.NUM_BANDS; m++) {
            double center = lower + (upper - lower) * (m + 1) / (MelParams.NUM_BANDS + 1);
            double distance = Math.abs(center - target);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = m;
            }
        }
        return best;
    }
}
