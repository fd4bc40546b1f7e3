package com.eyelevel.bordereaux.service.file;

import com.eyelevel.bordereaux.model.BordereauxFile;

/**
 * @param duplicate the content was already registered and {@code file} is the earlier record
 */
public record IntakeResult(BordereauxFile file, boolean duplicate) {
}
