package com.phillippitts.audioprep.service.encoding;

import java.io.Serializable;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bijection between class labels and integer ids {@code 0..numClasses-1}.
 * Ids follow the lexicographic order of the labels.
 */
public final class LabelEncoding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> classes;
    private transient Map<String, Integer> ids;

    LabelEncoding(List<String> sortedDistinctClasses) {
        this.classes = List.copyOf(sortedDistinctClasses);
    }

    public List<String> classes() {
        return classes;
    }

    public int numClasses() {
        return classes.size();
    }

    /**
     * @throws IllegalArgumentException if the label was not seen when fitting
     */
    public int idOf(String label) {
        Integer id = idIndex().get(label);
        if (id == null) {
            throw new IllegalArgumentException("Label '" + label + "' is not in the encoding " + classes);
        }
        return id;
    }

    /**
     * @throws IllegalArgumentException if the id is out of range
     */
    public String labelOf(int id) {
        if (id < 0 || id >= classes.size()) {
            throw new IllegalArgumentException("Id " + id + " out of range [0, " + classes.size() + ")");
        }
        return classes.get(id);
    }

    public boolean contains(String label) {
        return idIndex().containsKey(label);
    }

    /**
     * Maps each label to its id, preserving order.
     */
    public int[] transform(Collection<String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        int[] out = new int[labels.size()];
        int i = 0;
        for (String label : labels) {
            out[i++] = idOf(label);
        }
        return out;
    }

    private Map<String, Integer> idIndex() {
        Map<String, Integer> index = ids;
        if (index == null) {
            index = new HashMap<>();
            for (int i = 0; i < classes.size(); i++) {
                index.put(classes.get(i), i);
            }
            ids = index;
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LabelEncoding other && classes.equals(other.classes);
    }

    @Override
    public int hashCode() {
        return classes.hashCode();
    }

    @Override
    public String toString() {
        return "LabelEncoding" + classes;
    }
}
