package com.phillippitts.audioprep.config;

import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.audioprep.service.feature.MelParams.EXAMPLE_HOP_FRAMES;
import static com.phillippitts.audioprep.service.feature.MelParams.EXAMPLE_WINDOW_FRAMES;
import static com.phillippitts.audioprep.service.feature.MelParams.FFT_LENGTH;
import static com.phillippitts.audioprep.service.feature.MelParams.MEL_MAX_HZ;
import static com.phillippitts.audioprep.service.feature.MelParams.MEL_MIN_HZ;
import static com.phillippitts.audioprep.service.feature.MelParams.NUM_BANDS;
import static com.phillippitts.audioprep.service.feature.MelParams.NUM_FRAMES;
import static com.phillippitts.audioprep.service.feature.MelParams.SAMPLE_RATE;
import static com.phillippitts.audioprep.service.feature.MelParams.STFT_HOP_SAMPLES;
import static com.phillippitts.audioprep.service.feature.MelParams.STFT_WINDOW_SAMPLES;

/**
 * Startup sanity check for the log-mel feature constants.
 * Logs the effective parameters and fails fast if they disagree with the example shape.
 */
@Configuration
class MelParamsConfig {
    private static final Logger LOG = LogManager.getLogger(MelParamsConfig.class);

    @PostConstruct
    void validateMelParams() {
        if (EXAMPLE_WINDOW_FRAMES != NUM_FRAMES || EXAMPLE_HOP_FRAMES <= 0
                || FFT_LENGTH < STFT_WINDOW_SAMPLES || Integer.bitCount(FFT_LENGTH) != 1
                || MEL_MAX_HZ > SAMPLE_RATE / 2.0 || MEL_MIN_HZ >= MEL_MAX_HZ) {
            throw new IllegalStateException(
                    "Mel feature constants misconfigured. Expected " + NUM_FRAMES
                            + "-frame examples, a power-of-two FFT and mel edges below Nyquist.");
        }
        LOG.info("Log-mel features configured: sampleRate={} Hz, window={} samples, hop={} samples, "
                        + "fft={}, bands={} ({}-{} Hz), example={}x{}",
                SAMPLE_RATE, STFT_WINDOW_SAMPLES, STFT_HOP_SAMPLES, FFT_LENGTH, NUM_BANDS,
                MEL_MIN_HZ, MEL_MAX_HZ, NUM_FRAMES, NUM_BANDS);
    }
}
