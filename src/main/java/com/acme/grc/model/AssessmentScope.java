package com.acme.grc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Filters shared by every control of one assessment. */
public record AssessmentScope(Map<String, String> filters) {
    public AssessmentScope {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static AssessmentScope empty() { return new AssessmentScope(Map.of()); }
}
