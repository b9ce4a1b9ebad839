package com.acme.grc.model;

import java.util.List;

public record ControlConfig(String id, String name, String assessmentName,
                            List<String> linkedControlIds, List<String> evidenceConfigIds) {
    public ControlConfig {
        linkedControlIds = linkedControlIds == null ? List.of() : List.copyOf(linkedControlIds);
        evidenceConfigIds = evidenceConfigIds == null ? List.of() : List.copyOf(evidenceConfigIds);
    }
}
