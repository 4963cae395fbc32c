package com.phillippitts.audioprep.domain;

import com.phillippitts.audioprep.exception.InvalidDatasetTypeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTypeTest {

    @Test
    void resolvesNamesIgnoringCase() {
        assertThat(DatasetType.fromName("train")).isEqualTo(DatasetType.TRAIN);
        assertThat(DatasetType.fromName("Validate")).isEqualTo(DatasetType.VALIDATE);
        assertThat(DatasetType.fromName(" TEST ")).isEqualTo(DatasetType.TEST);
    }

    @Test
    void rejectsUnknownName() {
        assertThatThrownBy(() -> DatasetType.fromName("holdout"))
                .isInstanceOf(InvalidDatasetTypeException.class)
                .hasMessageContaining("holdout")
                .hasMessageContaining("TRAIN");
    }

    @Test
    void rejectsNullName() {
        assertThatThrownBy(() -> DatasetType.fromName(null))
                .isInstanceOf(InvalidDatasetTypeException.class);
    }

    @Test
    void featuresFileNameUsesUpperCaseSplitName() {
        assertThat(DatasetType.TRAIN.featuresFileName()).isEqualTo("TRAIN.features");
        assertThat(DatasetType.VALIDATE.featuresFileName()).isEqualTo("VALIDATE.features");
        assertThat(DatasetType.TEST.featuresFileName()).isEqualTo("TEST.features");
    }
}
