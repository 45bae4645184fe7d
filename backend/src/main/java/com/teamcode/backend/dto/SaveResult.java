package com.teamcode.backend.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a validated write. When {@code errors} is non-empty nothing was persisted.
 */
public record SaveResult<T>(T entity, Map<String, List<String>> errors) {

    public static <T> SaveResult<T> saved(T entity) {
        return new SaveResult<>(entity, Collections.emptyMap());
    }

    public static <T> SaveResult<T> rejected(T entity, Map<String, List<String>> errors) {
        return new SaveResult<>(entity, Collections.unmodifiableMap(errors));
    }

    public boolean isSaved() {
        return errors.isEmpty();
    }
}
