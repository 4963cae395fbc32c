/**
 * Directory walking and label inference.
 */
package com.phillippitts.audioprep.service.index;
