package com.phillippitts.audioprep.exception;

import com.phillippitts.audioprep.domain.DatasetType;

import java.util.Arrays;

/**
 * Thrown when a split name does not match one of the recognized {@link DatasetType} values.
 * This is a configuration error and aborts the requested save or load.
 */
public class InvalidDatasetTypeException extends AudioPrepException {

    private final String requestedName;

    public InvalidDatasetTypeException(String requestedName) {
        super("Invalid dataset type '" + requestedName + "'. Expected one of "
                + Arrays.toString(DatasetType.values()));
        this.requestedName = requestedName;
    }

    public String getRequestedName() {
        return requestedName;
    }
}
