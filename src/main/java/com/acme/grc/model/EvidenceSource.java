package com.acme.grc.model;

import java.util.List;

public record EvidenceSource(String evidenceConfigId, String evidenceName, EvidenceSchema schema, List<String> referencedBy) {
    public EvidenceSource {
        referencedBy = referencedBy == null ? List.of() : List.copyOf(referencedBy);
    }
}
