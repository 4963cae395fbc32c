package com.phillippitts.audioprep.service.pipeline;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.DatasetType;
import com.phillippitts.audioprep.domain.FeatureExample;
import com.phillippitts.audioprep.domain.LoadedFeatures;
import com.phillippitts.audioprep.exception.MissingFeaturesException;
import com.phillippitts.audioprep.service.audio.JavaSoundAudioReader;
import com.phillippitts.audioprep.service.audio.LinearResampler;
import com.phillippitts.audioprep.service.encoding.LabelEncoder;
import com.phillippitts.audioprep.service.encoding.LabelEncoding;
import com.phillippitts.audioprep.service.encoding.LabelEncodingStore;
import com.phillippitts.audioprep.service.feature.FeatureExtractor;
import com.phillippitts.audioprep.service.feature.LogMelSpectrogram;
import com.phillippitts.audioprep.service.feature.MelParams;
import com.phillippitts.audioprep.service.feature.SpectrogramFramer;
import com.phillippitts.audioprep.service.index.AudioIndexer;
import com.phillippitts.audioprep.service.metrics.PipelineMetrics;
import com.phillippitts.audioprep.service.persistence.FeatureStore;
import com.phillippitts.audioprep.service.segment.SegmentQuantizer;
import com.phillippitts.audioprep.service.split.DatasetSplitter;
import com.phillippitts.audioprep.testutil.SyncExecutor;
import com.phillippitts.audioprep.testutil.WavFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetPreparationServiceTest {

    @TempDir
    Path workDir;

    private Path dataDir;
    private DatasetProperties properties;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        dataDir = workDir.resolve("data");
        properties = new DatasetProperties();
        properties.setDataPath(dataDir.toString());
        properties.setOutputPath(workDir.resolve("output").toString());
        registry = new SimpleMeterRegistry();

        // 10 Orca files of 11 s each: 2 segments per file after dropping the trailing one
        for (int i = 0; i < 10; i++) {
            WavFixtures.tone(dataDir.resolve("Orca/2019/orca" + i + ".wav"), 16_000, 1, 11.0, 400 + 50 * i);
        }
        // 3 Seal files: below the 10-file minimum
        for (int i = 0; i < 3; i++) {
            WavFixtures.tone(dataDir.resolve("Seal/2020/seal" + i + ".wav"), 16_000, 1, 11.0, 900);
        }
    }

    @Test
    void preparesAllThreeSplits() {
        DatasetPreparationService service = service();

        assertThat(service.prepare(false)).isTrue();

        for (DatasetType type : DatasetType.values()) {
            assertThat(dataDir.resolve(type.featuresFileName())).isRegularFile();
        }
        // Orca: 7 train, 2 validate, 1 test files; 2 segments each
        assertThat(service.loadFeatures("TRAIN").size()).isEqualTo(14);
        assertThat(service.loadFeatures("validate").size()).isEqualTo(4);
        assertThat(service.loadFeatures("test").size()).isEqualTo(2);
        assertThat(registry.get("audioprep.pipeline.labels_dropped").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("audioprep.pipeline.segments").tag("split", "TRAIN").counter().count())
                .isEqualTo(14.0);
    }

    @Test
    void loadedExamplesHaveCanonicalShapeAndRetainedLabelsOnly() {
        DatasetPreparationService service = service();
        service.prepare(false);

        LoadedFeatures train = service.loadFeatures("train");

        assertThat(train.labels()).containsOnly("Orca");
        for (FeatureExample example : train.features()) {
            assertThat(example.shape()).containsExactly(MelParams.NUM_FRAMES, MelParams.NUM_BANDS, 1);
            assertThat(example.isAllZero()).isFalse();
        }
    }

    @Test
    void skipsWhenAllArtifactsExistUnlessOverwriting() {
        DatasetPreparationService service = service();
        service.prepare(false);

        assertThat(service.prepare(false)).isFalse();
        assertThat(dataDir.resolve("TRAIN.features-old")).doesNotExist();

        assertThat(service.prepare(true)).isTrue();
        assertThat(dataDir.resolve("TRAIN.features-old")).isRegularFile();
    }

    @Test
    void regeneratesWhenAnyArtifactIsMissing() throws Exception {
        DatasetPreparationService service = service();
        service.prepare(false);
        Files.delete(dataDir.resolve("TEST.features"));

        assertThat(service.prepare(false)).isTrue();
        assertThat(dataDir.resolve("TEST.features")).isRegularFile();
    }

    @Test
    void sameSeedReproducesSplitContents() {
        service().prepare(false);
        List<FeatureExample> first = service().loadFeatures("test").features();

        service().prepare(true);
        List<FeatureExample> second = service().loadFeatures("test").features();

        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    void loadAppliesConfiguredLabelRemapping() {
        service().prepare(false);
        properties.setOtherClasses(Set.of("Orca"));

        assertThat(service().loadFeatures("train").labels()).containsOnly("Other");

        properties.setRemoveClasses(Set.of("Orca"));
        assertThat(service().loadFeatures("train").isEmpty()).isTrue();
    }

    @Test
    void loadBeforePreparationFails() {
        assertThatThrownBy(() -> service().loadFeatures("train"))
                .isInstanceOf(MissingFeaturesException.class);
    }

    @Test
    void clearsSplitFromThreadContextAfterRun() {
        service().prepare(false);

        assertThat(ThreadContext.get(DatasetPreparationService.MDC_SPLIT)).isNull();
    }

    @Test
    void recordsStageTimings() {
        service().prepare(false);

        assertThat(registry.get("audioprep.pipeline.stage.latency").tag("stage", "index").timer().count())
                .isEqualTo(1);
        assertThat(registry.get("audioprep.pipeline.stage.latency")
                .tag("stage", "extract").tag("split", "VALIDATE").timer().count()).isEqualTo(1);
    }

    @Test
    void createsAndPersistsLabelEncoding() {
        DatasetPreparationService service = service();

        LabelEncoding encoding = service.createLabelEncoding(List.of("Seal", "Orca", "Other"), "run1");

        assertThat(encoding.classes()).containsExactly("Orca", "Other", "Seal");
        assertThat(workDir.resolve("output/label_encoder_run1.csv")).isRegularFile();
        assertThat(new LabelEncodingStore(workDir.resolve("output")).loadLatest()).isEqualTo(encoding);
    }

    @Test
    void labelEncodingWithoutTimestampIsReachableAsLatest() {
        LabelEncoding encoding = service().createLabelEncoding(List.of("Orca", "Other"));

        assertThat(workDir.resolve("output/label_encoder_latest.csv")).exists();
        assertThat(new LabelEncodingStore(workDir.resolve("output")).loadLatest().classes())
                .isEqualTo(encoding.classes());
    }

    private DatasetPreparationService service() {
        PipelineMetrics metrics = new PipelineMetrics(registry);
        JavaSoundAudioReader reader = new JavaSoundAudioReader();
        return new DatasetPreparationService(
                properties,
                new AudioIndexer(properties),
                new DatasetSplitter(new Random(properties.getShuffleSeed()), properties.getMinFilesPerLabel(), metrics),
                new SegmentQuantizer(reader, properties),
                new FeatureExtractor(reader, new LinearResampler(), new LogMelSpectrogram(),
                        new SpectrogramFramer(), metrics, new SyncExecutor()),
                new FeatureStore(properties),
                new LabelEncoder(),
                new LabelEncodingStore(properties),
                metrics);
    }
}
