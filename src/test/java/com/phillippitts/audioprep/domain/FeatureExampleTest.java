package com.phillippitts.audioprep.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureExampleTest {

    @Test
    void zerosHaveRequestedShapeWithChannelDimension() {
        FeatureExample example = FeatureExample.zeros("Orca", 496, 64);

        assertThat(example.shape()).containsExactly(496, 64, 1);
        assertThat(example.isAllZero()).isTrue();
    }

    @Test
    void equalityComparesArrayContents() {
        FeatureExample a = new FeatureExample("Orca", new float[][] {{1f, 2f}, {3f, 4f}});
        FeatureExample b = new FeatureExample("Orca", new float[][] {{1f, 2f}, {3f, 4f}});
        FeatureExample c = new FeatureExample("Orca", new float[][] {{1f, 2f}, {3f, 5f}});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
        assertThat(a).isNotEqualTo(a.withLabel("Other"));
    }

    @Test
    void withLabelKeepsValues() {
        FeatureExample a = new FeatureExample("Orca", new float[][] {{0.5f}});
        FeatureExample relabeled = a.withLabel("Other");

        assertThat(relabeled.label()).isEqualTo("Other");
        assertThat(relabeled.value(0, 0)).isEqualTo(0.5f);
        assertThat(relabeled.isAllZero()).isFalse();
    }

    @Test
    void callerArraysCannotChangeShapeOrValues() {
        float[][] source = {{1f, 2f}, {3f, 4f}};
        FeatureExample example = new FeatureExample("Orca", source);

        source[0] = new float[] {9f};
        source[1][1] = 7f;
        float[][] exposed = example.values();
        exposed[0] = new float[] {8f, 8f, 8f};
        exposed[1][0] = 6f;

        assertThat(example.shape()).containsExactly(2, 2, 1);
        assertThat(example.values()).isDeepEqualTo(new float[][] {{1f, 2f}, {3f, 4f}});
    }

    @Test
    void relabeledCopyIsIndependentOfOriginal() {
        FeatureExample a = new FeatureExample("Orca", new float[][] {{0.5f}});

        a.withLabel("Other").values()[0][0] = 2f;

        assertThat(a.value(0, 0)).isEqualTo(0.5f);
    }

    @Test
    void rejectsRaggedValues() {
        assertThatThrownBy(() -> new FeatureExample("Orca", new float[][] {{1f, 2f}, {3f}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rectangular");
    }

    @Test
    void segmentRefValidatesRange() {
        assertThatThrownBy(() -> new SegmentRef("Orca", Path.of("a.wav"), -1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SegmentRef("Orca", Path.of("a.wav"), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SegmentRef("Orca", Path.of("a.wav"), 100, 50).endFrame()).isEqualTo(150);
    }

    @Test
    void loadedFeaturesRequiresParallelLists() {
        FeatureExample example = FeatureExample.zeros("Orca", 2, 2);
        assertThatThrownBy(() -> new LoadedFeatures(List.of("Orca", "Seal"), List.of(example)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
