package com.phillippitts.audioprep.service.health;

import com.phillippitts.audioprep.domain.DatasetType;
import com.phillippitts.audioprep.service.persistence.FeatureStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureArtifactsHealthIndicatorTest {

    @TempDir
    Path dataDir;

    @Test
    void shouldReportUpWhenAllArtifactsPresent() {
        FeatureStore store = new FeatureStore(dataDir, "Other");
        for (DatasetType type : DatasetType.values()) {
            store.save(type, List.of());
        }

        Health health = new FeatureArtifactsHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "All feature artifacts present");
        assertThat(health.getDetails().get("train")).asString().startsWith("present at");
        assertThat(health.getDetails().get("test")).asString().contains("TEST.features");
    }

    @Test
    void shouldReportDownWithMissingSplit() {
        FeatureStore store = new FeatureStore(dataDir, "Other");
        store.save(DatasetType.TRAIN, List.of());
        store.save(DatasetType.VALIDATE, List.of());

        Health health = new FeatureArtifactsHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("validate")).asString().startsWith("present at");
        assertThat(health.getDetails().get("test")).asString().startsWith("NOT FOUND at");
    }

    @Test
    void shouldReportDownWhenNothingGenerated() {
        Health health = new FeatureArtifactsHealthIndicator(new FeatureStore(dataDir, "Other")).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsKeys("status", "train", "validate", "test");
    }
}
