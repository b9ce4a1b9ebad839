package com.acme.grc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters scoping SQL to one control.
 *
 * @param filters   equality predicates, field to value
 * @param groupBy   fields identifying one control context in the summary query
 * @param columns   projection for the selection query, empty for every schema field
 * @param criterion optional compliance test applied per row
 */
public record ControlScope(Map<String, String> filters, List<String> groupBy, List<String> columns,
                           ComplianceCriterion criterion) {
    public ControlScope {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static ControlScope empty() { return new ControlScope(Map.of(), List.of(), List.of(), null); }
}
