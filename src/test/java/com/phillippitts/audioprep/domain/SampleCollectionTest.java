package com.phillippitts.audioprep.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleCollectionTest {

    @Test
    void addCreatesLabelOnFirstUseAndPreservesOrder() {
        SampleCollection samples = new SampleCollection();
        samples.add("Orca", Path.of("b.wav"));
        samples.add("Orca", Path.of("a.wav"));
        samples.add("Seal", Path.of("c.wav"));

        assertThat(samples.labels()).containsExactly("Orca", "Seal");
        assertThat(samples.files("Orca")).containsExactly(Path.of("b.wav"), Path.of("a.wav"));
        assertThat(samples.fileCount()).isEqualTo(3);
        assertThat(samples.labelCount()).isEqualTo(2);
    }

    @Test
    void unknownLabelHasNoFiles() {
        SampleCollection samples = new SampleCollection();
        assertThat(samples.files("missing")).isEmpty();
        assertThat(samples.contains("missing")).isFalse();
        assertThat(samples.isEmpty()).isTrue();
    }

    @Test
    void flattensLabelByLabel() {
        SampleCollection samples = new SampleCollection();
        samples.addAll("A", List.of(Path.of("1.wav"), Path.of("2.wav")));
        samples.add("B", Path.of("3.wav"));

        assertThat(samples.toLabeledFiles()).containsExactly(
                new LabeledFile("A", Path.of("1.wav")),
                new LabeledFile("A", Path.of("2.wav")),
                new LabeledFile("B", Path.of("3.wav")));
    }

    @Test
    void exposedViewsAreReadOnly() {
        SampleCollection samples = new SampleCollection();
        samples.add("A", Path.of("1.wav"));

        assertThatThrownBy(() -> samples.files("A").add(Path.of("2.wav")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> samples.labels().add("B"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
