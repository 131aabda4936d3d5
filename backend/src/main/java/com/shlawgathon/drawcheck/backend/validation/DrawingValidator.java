package com.shlawgathon.drawcheck.backend.validation;

import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;

/**
 * Rule validator for one domain. Implementations are stateless and must not
 * modify their inputs, so one instance can serve concurrent requests.
 */
public interface DrawingValidator {

    ValidationDomain domain();

    ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params);
}
