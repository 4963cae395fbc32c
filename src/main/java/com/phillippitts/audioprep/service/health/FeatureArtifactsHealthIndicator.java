package com.phillippitts.audioprep.service.health;

import com.phillippitts.audioprep.domain.DatasetType;
import com.phillippitts.audioprep.service.persistence.FeatureStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Health indicator for the persisted feature artifacts.
 *
 * <p>UP when every split's {@code .features} file exists, DOWN otherwise. Each split is
 * reported as a detail entry.
 *
 * <p>Exposed through the JMX {@code Health} endpoint
 * ({@code org.springframework.boot:type=Endpoint,name=Health}) for the lifetime of a run.
 */
@Component
public class FeatureArtifactsHealthIndicator implements HealthIndicator {

    private final FeatureStore featureStore;

    public FeatureArtifactsHealthIndicator(FeatureStore featureStore) {
        this.featureStore = featureStore;
    }

    @Override
    public Health health() {
        Health.Builder builder = featureStore.allSplitsExist()
                ? Health.up().withDetail("status", "All feature artifacts present")
                : Health.down().withDetail("status", "Missing feature artifacts; run dataset preparation");

        for (DatasetType type : DatasetType.values()) {
            builder.withDetail(type.name().toLowerCase(Locale.ROOT),
                    formatStatus(featureStore.exists(type), featureStore.artifactPath(type)));
        }
        return builder.build();
    }

    private String formatStatus(boolean exists, Path path) {
        if (exists) {
            return "present at " + path;
        }
        return "NOT FOUND at " + path;
    }
}
