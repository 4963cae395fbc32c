package com.phillippitts.audioprep.exception;

/**
 * Thrown when an audio file cannot be opened or decoded into PCM samples,
 * or when a read request falls outside the file.
 */
public class InvalidAudioException extends AudioPrepException {

    private final String audioPath;
    private final String reason;

    public InvalidAudioException(String audioPath, String reason) {
        super("Invalid audio file " + audioPath + ": " + reason);
        this.audioPath = audioPath;
        this.reason = reason;
    }

    public InvalidAudioException(String audioPath, String reason, Throwable cause) {
        super("Invalid audio file " + audioPath + ": " + reason, cause);
        this.audioPath = audioPath;
        this.reason = reason;
    }

    public String getAudioPath() {
        return audioPath;
    }

    public String getReason() {
        return reason;
    }
}
