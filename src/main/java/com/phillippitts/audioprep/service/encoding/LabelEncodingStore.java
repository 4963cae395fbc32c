package com.phillippitts.audioprep.service.encoding;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.exception.FeatureStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Persists label encodings under the output directory.
 *
 * <p>Each save writes {@code label_encoder_<ts>.p} (serialized {@link LabelEncoding}) and
 * {@code label_encoder_<ts>.csv} ({@code encoded_id,label}), then repoints
 * {@code label_encoder_latest.p} and {@code label_encoder_latest.csv} at them.
 */
@Component
public class LabelEncodingStore {
    private static final Logger LOG = LogManager.getLogger(LabelEncodingStore.class);

    static final String PREFIX = "label_encoder_";
    static final String LATEST = "latest";
    static final String SERIALIZED_EXT = ".p";
    static final String CSV_EXT = ".csv";
    static final String CSV_HEADER = "encoded_id,label";

    private final Path outputPath;

    @Autowired
    public LabelEncodingStore(DatasetProperties properties) {
        this(Paths.get(properties.getOutputPath()));
    }

    public LabelEncodingStore(Path outputPath) {
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath must not be null");
    }

    public Path serializedPath(String runTimestamp) {
        return outputPath.resolve(PREFIX + runTimestamp + SERIALIZED_EXT);
    }

    public Path csvPath(String runTimestamp) {
        return outputPath.resolve(PREFIX + runTimestamp + CSV_EXT);
    }

    /**
     * Writes both artifacts for {@code runTimestamp} and makes them the latest.
     *
     * @throws IllegalArgumentException if {@code runTimestamp} is blank or the reserved {@code latest} name
     * @throws FeatureStoreException if any artifact cannot be written
     */
    public void save(LabelEncoding encoding, String runTimestamp) {
        Objects.requireNonNull(encoding, "encoding must not be null");
        Objects.requireNonNull(runTimestamp, "runTimestamp must not be null");
        if (runTimestamp.isBlank() || LATEST.equalsIgnoreCase(runTimestamp)) {
            throw new IllegalArgumentException("runTimestamp must be non-blank and not '" + LATEST
                    + "', got: '" + runTimestamp + "'");
        }
        Path serialized = serializedPath(runTimestamp);
        Path csv = csvPath(runTimestamp);
        try {
            Files.createDirectories(outputPath);
            try (ObjectOutputStream out = new ObjectOutputStream(
                    new BufferedOutputStream(Files.newOutputStream(serialized)))) {
                out.writeObject(encoding);
            }
            LOG.info("Saved label encoder to {}", serialized);
            pointLatestAt(serialized, serializedPath(LATEST));

            try (BufferedWriter writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
                writer.write(CSV_HEADER);
                writer.newLine();
                for (int id = 0; id < encoding.numClasses(); id++) {
                    writer.write(id + "," + csvField(encoding.labelOf(id)));
                    writer.newLine();
                }
            }
            LOG.info("Saved label encoder (in csv format) to {}", csv);
            pointLatestAt(csv, csvPath(LATEST));
        } catch (IOException e) {
            throw new FeatureStoreException("Failed to save label encoding", outputPath.toString(), e);
        }
    }

    /**
     * Loads the encoding most recently saved.
     */
    public LabelEncoding loadLatest() {
        return load(LATEST);
    }

    /**
     * Loads the encoding saved for {@code runTimestamp}.
     *
     * @throws FeatureStoreException if the artifact is missing or unreadable
     */
    public LabelEncoding load(String runTimestamp) {
        Path source = serializedPath(runTimestamp);
        if (!Files.exists(source)) {
            throw new FeatureStoreException("Label encoding not found", source.toString(), null);
        }
        try (ObjectInputStream in = new ObjectInputStream(
                new BufferedInputStream(Files.newInputStream(source)))) {
            Object content = in.readObject();
            if (content instanceof LabelEncoding encoding) {
                return encoding;
            }
            throw new FeatureStoreException("Unexpected label encoding content", source.toString(), null);
        } catch (ClassNotFoundException | IOException e) {
            throw new FeatureStoreException("Failed to read label encoding", source.toString(), e);
        }
    }

    private void pointLatestAt(Path target, Path link) throws IOException {
        Files.deleteIfExists(link);
        try {
            Files.createSymbolicLink(link, link.getParent().relativize(target));
            LOG.info("Created symbolic link {} -> {}", link, target.getFileName());
        } catch (UnsupportedOperationException | IOException e) {
            LOG.warn("Symbolic link {} not supported ({}); copying {} instead", link, e.getMessage(), target);
            Files.copy(target, link, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String csvField(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
