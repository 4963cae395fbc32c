package com.phillippitts.audioprep.service.segment;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.LabeledFile;
import com.phillippitts.audioprep.domain.SampleCollection;
import com.phillippitts.audioprep.domain.SegmentRef;
import com.phillippitts.audioprep.service.audio.AudioInfo;
import com.phillippitts.audioprep.service.audio.AudioReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts audio files into fixed-length segment references using header metadata only.
 *
 * <p>For a file of {@code T} frames and a segment length of {@code S} frames, candidate
 * offsets are {@code 0, S, 2S, ...} below {@code T}; the last candidate is always dropped.
 * Files no longer than one segment produce nothing.
 */
@Service
public class SegmentQuantizer {
    private static final Logger LOG = LogManager.getLogger(SegmentQuantizer.class);

    private final AudioReader audioReader;
    private final double segmentSeconds;
    private final double maxSeconds;

    @Autowired
    public SegmentQuantizer(AudioReader audioReader, DatasetProperties properties) {
        this(audioReader, properties.getSegmentSeconds(), properties.getMaxSeconds());
    }

    public SegmentQuantizer(AudioReader audioReader, double segmentSeconds, double maxSeconds) {
        this.audioReader = Objects.requireNonNull(audioReader);
        if (segmentSeconds <= 0) {
            throw new IllegalArgumentException("segmentSeconds must be > 0, got: " + segmentSeconds);
        }
        this.segmentSeconds = segmentSeconds;
        this.maxSeconds = maxSeconds;
    }

    /**
     * Quantizes one file with the configured segment length.
     */
    public List<SegmentRef> quantize(String label, Path file) {
        return quantize(label, file, segmentSeconds, maxSeconds);
    }

    /**
     * Quantizes one file.
     *
     * @param label          label carried by every produced segment
     * @param file           audio file
     * @param segmentSeconds segment length in seconds
     * @param maxSeconds     accepted for compatibility; files longer than this are only logged
     * @return segments in offset order
     * @throws com.phillippitts.audioprep.exception.InvalidAudioException if the file cannot be read
     */
    public List<SegmentRef> quantize(String label, Path file, double segmentSeconds, double maxSeconds) {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(file, "file must not be null");
        AudioInfo info = audioReader.info(file);
        if (info.durationSeconds() > maxSeconds) {
            LOG.debug("{} runs {}s, longer than max {}s; segmenting in full",
                    file, String.format("%.2f", info.durationSeconds()), maxSeconds);
        }

        int segmentFrames = (int) (segmentSeconds * info.sampleRate());
        long totalFrames = info.frameCount();
        if (segmentFrames <= 0 || totalFrames <= segmentFrames) {
            return List.of();
        }

        List<SegmentRef> segments = new ArrayList<>();
        for (long offset = 0; offset < totalFrames; offset += segmentFrames) {
            segments.add(new SegmentRef(label, file, offset, segmentFrames));
        }
        segments.remove(segments.size() - 1);
        return segments;
    }

    /**
     * Quantizes every file of a split, label by label, files in order.
     */
    public List<SegmentRef> quantizeAll(SampleCollection samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        return quantizeAll(samples.toLabeledFiles());
    }

    /**
     * Quantizes the given files in list order and concatenates the results.
     */
    public List<SegmentRef> quantizeAll(List<LabeledFile> files) {
        Objects.requireNonNull(files, "files must not be null");
        List<SegmentRef> all = new ArrayList<>();
        for (LabeledFile file : files) {
            all.addAll(quantize(file.label(), file.path()));
        }
        LOG.info("Quantized {} audio segments from {} sample files", all.size(), files.size());
        return all;
    }
}
