package com.phillippitts.audioprep.service.split;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.DatasetSplits;
import com.phillippitts.audioprep.domain.SampleCollection;
import com.phillippitts.audioprep.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Stratified train/validate/test split.
 *
 * <p>Each label is split on its own so every split sees every retained label. Per label with
 * {@code n} files: shuffle, then take {@code floor((n + 1) * trainFraction)} files for TRAIN,
 * the next {@code floor((n + 1) * validateFraction)} for VALIDATE and the rest for TEST.
 * Labels with fewer than {@code minFilesPerLabel} files are left out of all three.
 */
@Service
public class DatasetSplitter {
    private static final Logger LOG = LogManager.getLogger(DatasetSplitter.class);

    private final Random random;
    private final int minFilesPerLabel;
    private final PipelineMetrics metrics;

    @Autowired
    public DatasetSplitter(@Qualifier("splitRandom") Random random,
                           DatasetProperties properties,
                           PipelineMetrics metrics) {
        this(random, properties.getMinFilesPerLabel(), metrics);
    }

    public DatasetSplitter(Random random, int minFilesPerLabel, PipelineMetrics metrics) {
        this.random = Objects.requireNonNull(random);
        this.metrics = Objects.requireNonNull(metrics);
        if (minFilesPerLabel < 1) {
            throw new IllegalArgumentException("minFilesPerLabel must be >= 1, got: " + minFilesPerLabel);
        }
        this.minFilesPerLabel = minFilesPerLabel;
    }

    /**
     * Splits the indexed samples. The input collection is not modified.
     *
     * @param samples          label to file list
     * @param trainFraction    share of each label for TRAIN, in {@code [0, 1]}
     * @param validateFraction share of each label for VALIDATE, in {@code [0, 1]}
     * @return the three splits
     * @throws IllegalArgumentException if a fraction is out of range or they sum above 1
     */
    public DatasetSplits split(SampleCollection samples, double trainFraction, double validateFraction) {
        Objects.requireNonNull(samples, "samples must not be null");
        validateFractions(trainFraction, validateFraction);

        DatasetSplits splits = DatasetSplits.empty();
        for (String label : samples.labels()) {
            List<Path> files = new ArrayList<>(samples.files(label));
            int n = files.size();
            if (n < minFilesPerLabel) {
                LOG.info("Insufficient data for label {} ({} files, need {}); skipping",
                        label, n, minFilesPerLabel);
                metrics.incrementLabelsDropped();
                continue;
            }
            Collections.shuffle(files, random);

            int trainCount = (int) ((n + 1) * trainFraction);
            int validateCount = (int) ((n + 1) * validateFraction);
            int trainEnd = Math.min(trainCount, n);
            int validateEnd = Math.min(trainEnd + validateCount, n);

            splits.train().addAll(label, files.subList(0, trainEnd));
            splits.validate().addAll(label, files.subList(trainEnd, validateEnd));
            splits.test().addAll(label, files.subList(validateEnd, n));
            LOG.debug("Label {}: {} train, {} validate, {} test",
                    label, trainEnd, validateEnd - trainEnd, n - validateEnd);
        }
        LOG.info("Split {} labels: train={} files, validate={} files, test={} files",
                splits.train().labelCount(), splits.train().fileCount(),
                splits.validate().fileCount(), splits.test().fileCount());
        return splits;
    }

    static void validateFractions(double trainFraction, double validateFraction) {
        if (!(trainFraction >= 0.0 && trainFraction <= 1.0)) {
            throw new IllegalArgumentException("trainFraction must be in [0, 1], got: " + trainFraction);
        }
        if (!(validateFraction >= 0.0 && validateFraction <= 1.0)) {
            throw new IllegalArgumentException("validateFraction must be in [0, 1], got: " + validateFraction);
        }
        if (trainFraction + validateFraction > 1.0) {
            throw new IllegalArgumentException("trainFraction + validateFraction must be <= 1, got: "
                    + (trainFraction + validateFraction));
        }
    }
}
