package com.acme.grc.model;

import com.acme.grc.model.Enums.QueryKind;

import java.util.List;
import java.util.Map;

/** Preview rows returned for one query, or the error that prevented them. */
public record SampleRows(QueryKind kind, List<Map<String, Object>> rows, Finding error) {
    public SampleRows {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static SampleRows of(QueryKind kind, List<Map<String, Object>> rows) { return new SampleRows(kind, rows, null); }
    public static SampleRows failed(QueryKind kind, Finding error) { return new SampleRows(kind, List.of(), error); }
}
