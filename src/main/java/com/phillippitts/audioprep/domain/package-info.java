/**
 * Immutable value types flowing through the dataset preparation pipeline.
 *
 * <p>{@link com.phillippitts.audioprep.domain.SampleCollection} is the one mutable holder;
 * it is built once per indexing pass and per split.
 */
package com.phillippitts.audioprep.domain;
