package com.teamcode.backend.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the Bean Validation constraints of an entity and collects them per property.
 */
@Component
@RequiredArgsConstructor
public class EntityValidator {

    private final Validator validator;

    public Map<String, List<String>> validate(Object target) {
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<Object> violation : validator.validate(target)) {
            errors.computeIfAbsent(violation.getPropertyPath().toString(), key -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        return errors;
    }
}
