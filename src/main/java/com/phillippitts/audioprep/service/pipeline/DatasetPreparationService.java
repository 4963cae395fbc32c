package com.phillippitts.audioprep.service.pipeline;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.DatasetSplits;
import com.phillippitts.audioprep.domain.DatasetType;
import com.phillippitts.audioprep.domain.FeatureExample;
import com.phillippitts.audioprep.domain.LoadedFeatures;
import com.phillippitts.audioprep.domain.SampleCollection;
import com.phillippitts.audioprep.domain.SegmentRef;
import com.phillippitts.audioprep.service.encoding.LabelEncoder;
import com.phillippitts.audioprep.service.encoding.LabelEncoding;
import com.phillippitts.audioprep.service.encoding.LabelEncodingStore;
import com.phillippitts.audioprep.service.feature.FeatureExtractor;
import com.phillippitts.audioprep.service.index.AudioIndexer;
import com.phillippitts.audioprep.service.metrics.PipelineMetrics;
import com.phillippitts.audioprep.service.persistence.FeatureStore;
import com.phillippitts.audioprep.service.segment.SegmentQuantizer;
import com.phillippitts.audioprep.service.split.DatasetSplitter;
import com.phillippitts.audioprep.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs the dataset preparation pipeline end to end and exposes the load and encode entry
 * points used by training code.
 *
 * <p>Stages: index the data directory, split per label, then for each split quantize into
 * segments, extract features and save the artifact. The split being processed is available
 * to log patterns as the {@code split} ThreadContext key.
 */
@Service
public class DatasetPreparationService {
    private static final Logger LOG = LogManager.getLogger(DatasetPreparationService.class);

    static final String MDC_SPLIT = "split";

    private final DatasetProperties properties;
    private final AudioIndexer indexer;
    private final DatasetSplitter splitter;
    private final SegmentQuantizer quantizer;
    private final FeatureExtractor extractor;
    private final FeatureStore featureStore;
    private final LabelEncoder labelEncoder;
    private final LabelEncodingStore encodingStore;
    private final PipelineMetrics metrics;

    public DatasetPreparationService(DatasetProperties properties,
                                     AudioIndexer indexer,
                                     DatasetSplitter splitter,
                                     SegmentQuantizer quantizer,
                                     FeatureExtractor extractor,
                                     FeatureStore featureStore,
                                     LabelEncoder labelEncoder,
                                     LabelEncodingStore encodingStore,
                                     PipelineMetrics metrics) {
        this.properties = Objects.requireNonNull(properties);
        this.indexer = Objects.requireNonNull(indexer);
        this.splitter = Objects.requireNonNull(splitter);
        this.quantizer = Objects.requireNonNull(quantizer);
        this.extractor = Objects.requireNonNull(extractor);
        this.featureStore = Objects.requireNonNull(featureStore);
        this.labelEncoder = Objects.requireNonNull(labelEncoder);
        this.encodingStore = Objects.requireNonNull(encodingStore);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Generates the feature artifacts for all three splits.
     *
     * @param overwrite regenerate even when every artifact already exists
     * @return {@code true} if artifacts were generated, {@code false} if the run was skipped
     */
    public boolean prepare(boolean overwrite) {
        if (!overwrite && featureStore.allSplitsExist()) {
            LOG.info("All feature files exist in {}; skipping preparation (use overwrite to regenerate)",
                    properties.getDataPath());
            return false;
        }

        SampleCollection samples = timed("index", PipelineMetrics.ALL_SPLITS,
                () -> indexer.index(Paths.get(properties.getDataPath())));
        DatasetSplits splits = timed("split", PipelineMetrics.ALL_SPLITS,
                () -> splitter.split(samples, properties.getTrainFraction(), properties.getValidateFraction()));

        for (DatasetType type : DatasetType.values()) {
            ThreadContext.put(MDC_SPLIT, type.name());
            try {
                prepareSplit(type, splits.get(type));
            } finally {
                ThreadContext.remove(MDC_SPLIT);
            }
        }
        LOG.info("Dataset preparation complete");
        return true;
    }

    private void prepareSplit(DatasetType type, SampleCollection split) {
        String name = type.name();
        List<SegmentRef> segments = timed("quantize", name, () -> quantizer.quantizeAll(split));
        metrics.incrementSegments(name, segments.size());
        LOG.info("Extracting features from {} segments for {} dataset", segments.size(), name);
        List<FeatureExample> examples = timed("extract", name, () -> extractor.extractAll(segments));
        timed("save", name, () -> featureStore.save(type, examples));
    }

    /**
     * Loads a split with the configured label removals and catch-all remapping applied.
     *
     * @throws com.phillippitts.audioprep.exception.InvalidDatasetTypeException if the name is unknown
     * @throws com.phillippitts.audioprep.exception.MissingFeaturesException if preparation has not run
     */
    public LoadedFeatures loadFeatures(String splitName) {
        return featureStore.load(splitName, properties.getRemoveClasses(), properties.getOtherClasses());
    }

    /**
     * Fits and saves an encoding stamped with the current local time.
     */
    public LabelEncoding createLabelEncoding(Collection<String> classes) {
        return createLabelEncoding(classes, TimeUtils.runTimestamp());
    }

    /**
     * Fits an encoding over {@code classes} and saves it under the run timestamp.
     */
    public LabelEncoding createLabelEncoding(Collection<String> classes, String runTimestamp) {
        LabelEncoding encoding = labelEncoder.fit(classes);
        encodingStore.save(encoding, runTimestamp);
        LOG.info("Label encoding for run {}: {} classes", runTimestamp, encoding.numClasses());
        return encoding;
    }

    private <T> T timed(String stage, String split, Supplier<T> work) {
        long t0 = System.nanoTime();
        try {
            return work.get();
        } finally {
            metrics.recordStageLatency(stage, split, System.nanoTime() - t0);
        }
    }
}
