package com.phillippitts.audioprep.domain;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable mapping from class label to the ordered list of audio files carrying that label.
 *
 * <p>File order within a label is preserved exactly as inserted. Label iteration follows
 * first-insertion order.
 */
public final class SampleCollection {

    private final Map<String, List<Path>> samples = new LinkedHashMap<>();

    /**
     * Appends a file to the label's list, creating an empty list for a new label first.
     */
    public void add(String label, Path file) {
        Objects.requireNonNull(file, "file must not be null");
        filesFor(label).add(file);
    }

    /**
     * Appends all files, in iteration order, to the label's list.
     */
    public void addAll(String label, Collection<Path> files) {
        Objects.requireNonNull(files, "files must not be null");
        filesFor(label).addAll(files);
    }

    private List<Path> filesFor(String label) {
        Objects.requireNonNull(label, "label must not be null");
        return samples.computeIfAbsent(label, k -> new ArrayList<>());
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(samples.keySet());
    }

    /**
     * @return the label's files in insertion order, or an empty list for an unknown label
     */
    public List<Path> files(String label) {
        List<Path> files = samples.get(label);
        return files == null ? List.of() : Collections.unmodifiableList(files);
    }

    public boolean contains(String label) {
        return samples.containsKey(label);
    }

    public int labelCount() {
        return samples.size();
    }

    public int fileCount() {
        int total = 0;
        for (List<Path> files : samples.values()) {
            total += files.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * Flattens the collection into (label, file) pairs, label by label, files in order.
     */
    public List<LabeledFile> toLabeledFiles() {
        List<LabeledFile> flat = new ArrayList<>(fileCount());
        samples.forEach((label, files) -> files.forEach(f -> flat.add(new LabeledFile(label, f))));
        return flat;
    }

    @Override
    public String toString() {
        return "SampleCollection{labels=" + labelCount() + ", files=" + fileCount() + "}";
    }
}
