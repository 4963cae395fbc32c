/**
 * Label to integer encoding, one-hot matrices and their persisted form.
 */
package com.phillippitts.audioprep.service.encoding;
