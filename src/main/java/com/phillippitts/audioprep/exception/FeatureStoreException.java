package com.phillippitts.audioprep.exception;

/**
 * Thrown when a persisted artifact (feature set or label encoding) cannot be written or read back.
 */
public class FeatureStoreException extends AudioPrepException {

    private final String artifactPath;

    public FeatureStoreException(String message, String artifactPath, Throwable cause) {
        super(message + " (path: " + artifactPath + ")", cause);
        this.artifactPath = artifactPath;
    }

    public String getArtifactPath() {
        return artifactPath;
    }
}
