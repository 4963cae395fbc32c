/**
 * Spring configuration: executors, startup constant checks, typed properties.
 */
package com.phillippitts.audioprep.config;
