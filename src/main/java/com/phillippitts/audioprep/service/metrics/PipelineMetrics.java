package com.phillippitts.audioprep.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for dataset preparation runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency per pipeline stage (index, split, quantize, extract, save)</li>
 *   <li>Segments produced per split</li>
 *   <li>Segments replaced by an all-zero example</li>
 *   <li>Labels left out of the split for lack of data</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "audioprep.pipeline";

    /** Tag value used for stages that are not tied to one split. */
    public static final String ALL_SPLITS = "all";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a pipeline stage took.
     *
     * @param stage stage name (index, split, quantize, extract, save)
     * @param split split name, or {@link #ALL_SPLITS}
     * @param durationNanos duration in nanoseconds
     */
    public void recordStageLatency(String stage, String split, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time taken by a dataset preparation stage")
                .tag("stage", stage)
                .tag("split", split)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Adds to the number of segments quantized for a split.
     */
    public void incrementSegments(String split, int count) {
        Counter.builder(METRIC_PREFIX + ".segments")
                .description("Number of audio segments quantized")
                .tag("split", split)
                .register(registry)
                .increment(count);
    }

    /**
     * Counts one segment too short to fill a feature window.
     */
    public void incrementZeroFilled() {
        Counter.builder(METRIC_PREFIX + ".zero_filled")
                .description("Number of segments substituted with an all-zero example")
                .register(registry)
                .increment();
    }

    /**
     * Counts one label dropped from the split for having too few files.
     */
    public void incrementLabelsDropped() {
        Counter.builder(METRIC_PREFIX + ".labels_dropped")
                .description("Number of labels skipped for insufficient data")
                .register(registry)
                .increment();
    }
}
