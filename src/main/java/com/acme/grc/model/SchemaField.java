package com.acme.grc.model;

import com.acme.grc.model.Enums.FieldMode;
import com.acme.grc.model.Enums.FieldType;
import com.fasterxml.jackson.annotation.JsonIgnore;

public record SchemaField(String name, FieldType type, FieldMode mode, int order) {
    public SchemaField {
        if (type == null) type = FieldType.TEXT;
        if (mode == null) mode = FieldMode.NULLABLE;
    }

    public static SchemaField of(String name, FieldType type) { return new SchemaField(name, type, FieldMode.NULLABLE, 0); }
    public static SchemaField key(String name, FieldType type) { return new SchemaField(name, type, FieldMode.KEY, 0); }

    @JsonIgnore
    public boolean isKey() { return mode == FieldMode.KEY; }
}
