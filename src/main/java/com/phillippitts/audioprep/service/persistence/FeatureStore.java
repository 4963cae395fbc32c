package com.phillippitts.audioprep.service.persistence;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.DatasetType;
import com.phillippitts.audioprep.domain.FeatureExample;
import com.phillippitts.audioprep.domain.LoadedFeatures;
import com.phillippitts.audioprep.exception.FeatureStoreException;
import com.phillippitts.audioprep.exception.MissingFeaturesException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads and writes per-split feature artifacts ({@code <dataPath>/<SPLIT>.features}).
 *
 * <p>Artifacts hold a serialized {@code List<FeatureExample>}. Saving first renames any existing
 * artifact to {@code <SPLIT>.features-old}, keeping one level of undo.
 */
@Component
public class FeatureStore {
    private static final Logger LOG = LogManager.getLogger(FeatureStore.class);

    public static final String BACKUP_SUFFIX = "-old";

    private final Path dataPath;
    private final String otherClass;

    @Autowired
    public FeatureStore(DatasetProperties properties) {
        this(Paths.get(properties.getDataPath()), properties.getOtherClass());
    }

    public FeatureStore(Path dataPath, String otherClass) {
        this.dataPath = Objects.requireNonNull(dataPath, "dataPath must not be null");
        this.otherClass = Objects.requireNonNull(otherClass, "otherClass must not be null");
    }

    public Path artifactPath(DatasetType type) {
        return dataPath.resolve(type.featuresFileName());
    }

    public Path backupPath(DatasetType type) {
        return dataPath.resolve(type.featuresFileName() + BACKUP_SUFFIX);
    }

    public boolean exists(DatasetType type) {
        return Files.isRegularFile(artifactPath(type));
    }

    public boolean allSplitsExist() {
        for (DatasetType type : DatasetType.values()) {
            if (!exists(type)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Saves features for a split given by name.
     *
     * @throws com.phillippitts.audioprep.exception.InvalidDatasetTypeException if the name is unknown
     */
    public Path save(String splitName, List<FeatureExample> examples) {
        return save(DatasetType.fromName(splitName), examples);
    }

    /**
     * Writes the examples, backing up any previous artifact first.
     *
     * @return path of the written artifact
     * @throws FeatureStoreException if the artifact cannot be written
     */
    public Path save(DatasetType type, List<FeatureExample> examples) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(examples, "examples must not be null");
        Path target = artifactPath(type);
        try {
            Files.createDirectories(dataPath);
            if (Files.exists(target)) {
                Path backup = backupPath(type);
                Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING);
                LOG.info("Renamed {} to {}", target, backup);
            }
            try (ObjectOutputStream out = new ObjectOutputStream(
                    new BufferedOutputStream(Files.newOutputStream(target)))) {
                out.writeObject(new ArrayList<>(examples));
            }
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to save " + type + " features", target.toString(), e);
        }
        LOG.info("Saved {} features of dataset {} to {}", examples.size(), type, target);
        return target;
    }

    /**
     * Loads features for a split given by name.
     *
     * @throws com.phillippitts.audioprep.exception.InvalidDatasetTypeException if the name is unknown
     */
    public LoadedFeatures load(String splitName, Collection<String> removeLabels,
                               Collection<String> renameToOther) {
        return load(DatasetType.fromName(splitName), removeLabels, renameToOther);
    }

    /**
     * Loads a split, dropping entries labeled with any of {@code removeLabels} and relabeling
     * entries labeled with any of {@code renameToOther} to the catch-all class. Feature values
     * are never altered.
     *
     * @throws MissingFeaturesException if the artifact does not exist
     * @throws FeatureStoreException if the artifact cannot be read or has unexpected content
     */
    public LoadedFeatures load(DatasetType type, Collection<String> removeLabels,
                               Collection<String> renameToOther) {
        Objects.requireNonNull(type, "type must not be null");
        Set<String> remove = removeLabels == null ? Set.of() : Set.copyOf(removeLabels);
        Set<String> other = renameToOther == null ? Set.of() : Set.copyOf(renameToOther);

        List<FeatureExample> stored = readArtifact(type);
        List<String> labels = new ArrayList<>(stored.size());
        List<FeatureExample> features = new ArrayList<>(stored.size());
        for (FeatureExample example : stored) {
            if (remove.contains(example.label())) {
                continue;
            }
            FeatureExample kept = other.contains(example.label()) ? example.withLabel(otherClass) : example;
            labels.add(kept.label());
            features.add(kept);
        }
        LOG.info("Loaded {} dataset from {}: {} of {} examples kept",
                type, artifactPath(type), features.size(), stored.size());
        return new LoadedFeatures(labels, features);
    }

    private List<FeatureExample> readArtifact(DatasetType type) {
        Path source = artifactPath(type);
        if (!Files.isRegularFile(source)) {
            throw new MissingFeaturesException(source.toString());
        }
        try (ObjectInputStream in = new ObjectInputStream(
                new BufferedInputStream(Files.newInputStream(source)))) {
            Object content = in.readObject();
            if (!(content instanceof List<?> list)) {
                throw new FeatureStoreException("Unexpected artifact content "
                        + (content == null ? "null" : content.getClass().getName()), source.toString(), null);
            }
            List<FeatureExample> examples = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof FeatureExample example)) {
                    throw new FeatureStoreException("Unexpected artifact entry "
                            + (item == null ? "null" : item.getClass().getName()), source.toString(), null);
                }
                examples.add(example);
            }
            return examples;
        } catch (ClassNotFoundException e) {
            throw new FeatureStoreException("Unknown class in feature artifact", source.toString(), e);
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to read feature artifact", source.toString(), e);
        }
    }
}
