package com.phillippitts.audioprep.service.index;

import com.phillippitts.audioprep.config.properties.DatasetProperties;
import com.phillippitts.audioprep.domain.SampleCollection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Walks a dataset tree and groups audio files by class label.
 *
 * <p>Expected layout is {@code root/<Label>/<Subfolder>/<file>.wav}: the label is the name of
 * the folder <em>above</em> the one holding the audio files, with every non-alphanumeric
 * character removed. Directories are visited top-down; within a directory, files are appended
 * in the order the filesystem lists them.
 */
@Service
public class AudioIndexer {
    private static final Logger LOG = LogManager.getLogger(AudioIndexer.class);

    private static final String NON_ALPHANUMERIC = "[^\\p{Alnum}]";

    private final List<String> extensions;

    @Autowired
    public AudioIndexer(DatasetProperties properties) {
        this(properties.getAudioExtensions());
    }

    AudioIndexer(List<String> extensions) {
        Objects.requireNonNull(extensions, "extensions must not be null");
        List<String> normalized = new ArrayList<>(extensions.size());
        for (String ext : extensions) {
            String lower = ext.trim().toLowerCase(Locale.ROOT);
            normalized.add(lower.startsWith(".") ? lower : "." + lower);
        }
        this.extensions = List.copyOf(normalized);
    }

    /**
     * Indexes every audio file under {@code root}.
     *
     * @param root dataset root directory
     * @return label to ordered file list; empty when the root holds no audio
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public SampleCollection index(Path root) {
        Objects.requireNonNull(root, "root must not be null");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Dataset root is not a directory: " + root);
        }
        SampleCollection samples = new SampleCollection();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    collectDirectory(dir, samples);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOG.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        LOG.debug("Directory {} not fully listed: {}", dir, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk dataset root " + root, e);
        }
        LOG.info("Indexed {}: observed {} labels for {} audio files",
                root, samples.labelCount(), samples.fileCount());
        return samples;
    }

    private void collectDirectory(Path dir, SampleCollection samples) {
        List<Path> audioFiles = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, this::isAudioFile)) {
            for (Path entry : entries) {
                audioFiles.add(entry);
            }
        } catch (IOException e) {
            LOG.debug("Skipping unreadable directory {}: {}", dir, e.getMessage());
            return;
        }
        if (audioFiles.isEmpty()) {
            return;
        }

        Path parent = dir.getParent();
        String label = parent == null || parent.getFileName() == null
                ? ""
                : sanitizeLabel(parent.getFileName().toString());
        if (label.isEmpty()) {
            LOG.warn("Skipping {} audio files in {}: no usable label from parent folder",
                    audioFiles.size(), dir);
            return;
        }
        samples.addAll(label, audioFiles);
    }

    boolean isAudioFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every character that is not a letter or digit.
     */
    public static String sanitizeLabel(String raw) {
        return raw.replaceAll(NON_ALPHANUMERIC, "");
    }
}
