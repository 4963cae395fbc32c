/**
 * Feature artifact persistence.
 */
package com.phillippitts.audioprep.service.persistence;
