package com.phillippitts.audioprep.service.audio;

import com.phillippitts.audioprep.exception.InvalidAudioException;

import java.nio.file.Path;

/**
 * Reads audio metadata and frame ranges from files on disk.
 *
 * <p>Implementations must be thread-safe; feature extraction calls {@link #read} concurrently.
 */
public interface AudioReader {

    /**
     * Reads header information without decoding sample data.
     *
     * @throws InvalidAudioException if the file is missing, unreadable or in an unsupported format
     */
    AudioInfo info(Path file);

    /**
     * Reads up to {@code frameCount} frames starting at {@code startFrame}. Fewer frames are
     * returned when the range extends past the end of the file.
     *
     * @throws InvalidAudioException if the file is missing, unreadable or in an unsupported format
     */
    PcmBlock read(Path file, long startFrame, int frameCount);
}
