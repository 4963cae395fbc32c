/**
 * Pipeline orchestration and the startup entry point.
 */
package com.phillippitts.audioprep.service.pipeline;
