package com.phillippitts.audioprep.exception;

/**
 * Thrown when a feature artifact is requested before it has been generated.
 * Callers must run dataset preparation first.
 */
public class MissingFeaturesException extends AudioPrepException {

    private final String artifactPath;

    public MissingFeaturesException(String artifactPath) {
        super("Feature file not found at path: " + artifactPath
                + ". Run dataset preparation to generate feature files first.");
        this.artifactPath = artifactPath;
    }

    public String getArtifactPath() {
        return artifactPath;
    }
}
