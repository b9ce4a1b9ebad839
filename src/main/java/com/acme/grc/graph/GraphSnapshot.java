package com.acme.grc.graph;

import com.acme.grc.model.ControlConfig;
import com.acme.grc.model.SchemaField;

import java.util.List;

/**
 * File form of a control graph export.
 * <pre>
 * controlConfigs:
 *   - id: A
 *     linkedControlIds: [B]
 *     evidenceConfigIds: [ev-1]
 * evidenceConfigs:
 *   - id: ev-1
 *     name: LoginEvents
 *     fields: [{name: user, type: TEXT, mode: KEY}]
 * </pre>
 * An evidence entry without {@code fields} has no resolvable schema.
 */
public record GraphSnapshot(List<ControlConfig> controlConfigs, List<EvidenceEntry> evidenceConfigs) {
    public GraphSnapshot {
        controlConfigs = controlConfigs == null ? List.of() : List.copyOf(controlConfigs);
        evidenceConfigs = evidenceConfigs == null ? List.of() : List.copyOf(evidenceConfigs);
    }

    public record EvidenceEntry(String id, String name, List<SchemaField> fields) {}
}
