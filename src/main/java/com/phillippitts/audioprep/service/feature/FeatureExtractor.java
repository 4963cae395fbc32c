package com.phillippitts.audioprep.service.feature;

import com.phillippitts.audioprep.domain.FeatureExample;
import com.phillippitts.audioprep.domain.SegmentRef;
import com.phillippitts.audioprep.exception.AudioPrepException;
import com.phillippitts.audioprep.service.audio.AudioReader;
import com.phillippitts.audioprep.service.audio.PcmBlock;
import com.phillippitts.audioprep.service.audio.Resampler;
import com.phillippitts.audioprep.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns segment references into fixed-shape log-mel feature examples.
 *
 * <p>Per segment: read the frame range, average channels to mono, resample to
 * {@link MelParams#SAMPLE_RATE} when needed, compute the log-mel spectrogram and cut it into
 * {@link MelParams#NUM_FRAMES}-frame windows. The first window becomes the example. A segment
 * too short for a single window yields an all-zero example so every segment still contributes
 * exactly one training row.
 *
 * <p><b>Thread Model:</b> {@link #extractAll(List)} fans out over {@code featureExecutor} and
 * joins results in input order. Segment tasks share no mutable state.
 */
@Service
public class FeatureExtractor {
    private static final Logger LOG = LogManager.getLogger(FeatureExtractor.class);

    static final int PROGRESS_INTERVAL = 500;

    private final AudioReader audioReader;
    private final Resampler resampler;
    private final LogMelSpectrogram spectrogram;
    private final SpectrogramFramer framer;
    private final PipelineMetrics metrics;
    private final Executor executor;

    public FeatureExtractor(AudioReader audioReader,
                            Resampler resampler,
                            LogMelSpectrogram spectrogram,
                            SpectrogramFramer framer,
                            PipelineMetrics metrics,
                            @Qualifier("featureExecutor") Executor executor) {
        this.audioReader = Objects.requireNonNull(audioReader);
        this.resampler = Objects.requireNonNull(resampler);
        this.spectrogram = Objects.requireNonNull(spectrogram);
        this.framer = Objects.requireNonNull(framer);
        this.metrics = Objects.requireNonNull(metrics);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * Extracts the feature example for one segment.
     *
     * @param segment segment to analyze
     * @return example of shape {@code (NUM_FRAMES, NUM_BANDS, 1)} labeled with the segment's label
     * @throws com.phillippitts.audioprep.exception.InvalidAudioException if the source cannot be read
     */
    public FeatureExample extract(SegmentRef segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        PcmBlock block = audioReader.read(segment.source(), segment.startFrame(), segment.frameCount());
        float[] mono = block.toMono();
        float[] samples = block.sampleRate() == MelParams.SAMPLE_RATE
                ? mono
                : resampler.resample(mono, block.sampleRate(), MelParams.SAMPLE_RATE);

        float[][] logMel = spectrogram.compute(samples);
        List<float[][]> windows = framer.frame(logMel,
                MelParams.EXAMPLE_WINDOW_FRAMES, MelParams.EXAMPLE_HOP_FRAMES);

        if (windows.isEmpty()) {
            LOG.warn("Segment {} yielded {} spectrogram frames (< {}); substituting an all-zero example",
                    segment, logMel.length, MelParams.EXAMPLE_WINDOW_FRAMES);
            metrics.incrementZeroFilled();
            return FeatureExample.zeros(segment.label(), MelParams.NUM_FRAMES, MelParams.NUM_BANDS);
        }
        if (windows.size() > 1) {
            LOG.debug("Segment {} yielded {} windows; keeping the first", segment, windows.size());
        }
        return new FeatureExample(segment.label(), windows.get(0));
    }

    /**
     * Extracts features for every segment, preserving input order.
     *
     * @param segments segments to analyze
     * @return one example per segment, same order
     * @throws com.phillippitts.audioprep.exception.InvalidAudioException if any source cannot be read
     */
    public List<FeatureExample> extractAll(List<SegmentRef> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        int total = segments.size();
        LOG.info("Extracting features from {} segments", total);
        AtomicInteger completed = new AtomicInteger();

        List<CompletableFuture<FeatureExample>> futures = new ArrayList<>(total);
        for (SegmentRef segment : segments) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                FeatureExample example = extract(segment);
                logProgress(completed.incrementAndGet(), total);
                return example;
            }, executor));
        }

        List<FeatureExample> examples = new ArrayList<>(total);
        for (CompletableFuture<FeatureExample> future : futures) {
            examples.add(join(future));
        }
        return examples;
    }

    private static FeatureExample join(CompletableFuture<FeatureExample> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new AudioPrepException("Feature extraction failed", cause);
        }
    }

    private static void logProgress(int done, int total) {
        if (done % PROGRESS_INTERVAL == 0) {
            LOG.info("Feature extraction progress: {}/{} ({}%)",
                    done, total, String.format("%.2f", 100.0 * done / total));
        }
    }
}
