package com.acme.grc.model;

import com.acme.grc.model.Enums.FieldType;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Field definitions of one evidence config, kept in declared field order. */
public record EvidenceSchema(String evidenceConfigId, List<SchemaField> fields) {
    public EvidenceSchema {
        fields = fields == null ? List.of() : fields.stream()
                .sorted(Comparator.comparingInt(SchemaField::order))
                .toList();
    }

    public Optional<SchemaField> field(String name) {
        if (name == null) return Optional.empty();
        for (SchemaField f : fields) {
            if (f.name().equalsIgnoreCase(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public Map<String, FieldType> signature() {
        Map<String, FieldType> sig = new LinkedHashMap<>();
        for (SchemaField f : fields) sig.put(f.name().toLowerCase(Locale.ROOT), f.type());
        return sig;
    }
}
