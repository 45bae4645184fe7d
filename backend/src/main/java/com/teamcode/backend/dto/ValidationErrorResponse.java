package com.teamcode.backend.dto;

import java.util.List;
import java.util.Map;

/**
 * Body of a 422 response: the violated fields, each with its messages.
 */
public record ValidationErrorResponse(String code, Map<String, List<String>> errors) {

    public static ValidationErrorResponse of(Map<String, List<String>> errors) {
        return new ValidationErrorResponse("VALIDATION_FAILED", errors);
    }
}
