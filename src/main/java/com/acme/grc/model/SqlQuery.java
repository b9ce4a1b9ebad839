package com.acme.grc.model;

import com.acme.grc.model.Enums.QueryKind;

import java.util.List;

/**
 * A synthesized SQL statement together with the tables and fields it references.
 */
public record SqlQuery(QueryKind kind, String sql, List<String> tables, List<String> fields) {
    public SqlQuery {
        tables = tables == null ? List.of() : List.copyOf(tables);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
