package com.acme.grc.model;

import com.acme.grc.model.Enums.QueryKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

public record QueryOutcome(QueryKind kind, SqlQuery query, Finding error) {
    public static QueryOutcome ok(SqlQuery q) { return new QueryOutcome(q.kind(), q, null); }
    public static QueryOutcome failed(QueryKind kind, Finding error) { return new QueryOutcome(kind, null, error); }

    @JsonIgnore
    public boolean succeeded() { return query != null; }
}
