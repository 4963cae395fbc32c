package com.phillippitts.audioprep.exception;

/**
 * Base exception for all audio-prep application-specific errors.
 * All domain exceptions extend this class so callers can handle pipeline failures in one place.
 */
public class AudioPrepException extends RuntimeException {

    public AudioPrepException(String message) {
        super(message);
    }

    public AudioPrepException(String message, Throwable cause) {
        super(message, cause);
    }

    public AudioPrepException(Throwable cause) {
        super(cause);
    }
}
