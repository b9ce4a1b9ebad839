package com.acme.grc.sql;

import java.util.List;

/** A scope, projection or criterion names a field that none of the resolved evidence schemas define. */
public class UndefinedFieldReferenceException extends RuntimeException {
    private final String field;

    public UndefinedFieldReferenceException(String field, List<String> tables) {
        super("Field '" + field + "' is not defined by " + (tables.size() == 1 ? "evidence " : "any of the evidence ") + tables);
        this.field = field;
    }

    public String field() { return field; }
}
