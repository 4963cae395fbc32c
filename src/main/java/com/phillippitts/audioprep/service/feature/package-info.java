/**
 * Waveform to log-mel feature conversion.
 */
package com.phillippitts.audioprep.service.feature;
