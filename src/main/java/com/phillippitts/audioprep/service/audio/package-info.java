/**
 * Audio decoding and sample-rate conversion.
 *
 * <p>{@link com.phillippitts.audioprep.service.audio.AudioReader} is the only component that
 * touches audio files; everything downstream works on normalized float arrays.
 */
package com.phillippitts.audioprep.service.audio;
