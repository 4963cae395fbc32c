/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.audioprep.exception.AudioPrepException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.audioprep.exception.InvalidDatasetTypeException} - Thrown when
 *       an unknown split name is requested</li>
 *   <li>{@link com.phillippitts.audioprep.exception.MissingFeaturesException} - Thrown when a
 *       feature file is loaded before it was generated</li>
 *   <li>{@link com.phillippitts.audioprep.exception.InvalidAudioException} - Thrown when an
 *       audio file cannot be decoded</li>
 *   <li>{@link com.phillippitts.audioprep.exception.FeatureStoreException} - Thrown when a
 *       persisted artifact cannot be written or read</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via a {@code cause} parameter.
 * Recoverable conditions (labels with too few files, segments too short for a spectrogram)
 * are logged instead of thrown.
 *
 * @see com.phillippitts.audioprep.exception.AudioPrepException
 * @since 1.0
 */
package com.phillippitts.audioprep.exception;
