/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Policy Control Compiler
 */

package com.acme.grc.graph;

import com.acme.grc.model.*;

import java.util.*;

/**
 * Accumulates one traversal. Only the coordinating thread writes to it.
 */
final class TraversalResultBuilder {
    private final String startId;
    private final Map<String, VisitedControl> visited = new LinkedHashMap<>();
    private final Map<String, EvidenceSource> evidence = new LinkedHashMap<>();
    private final Set<String> failedEvidence = new HashSet<>();
    private final Set<String> truncations = new LinkedHashSet<>();
    private final List<Finding> findings = new ArrayList<>();

    TraversalResultBuilder(String startId) { this.startId = startId; }

    boolean claim(VisitedControl v) { return visited.putIfAbsent(v.controlConfigId(), v) == null; }
    boolean isVisited(String id) { return visited.containsKey(id); }
    int visitedCount() { return visited.size(); }

    void addFinding(Finding f) { if (f != null) findings.add(f); }

    void addEvidence(String controlId, EvidenceConfig ev, EvidenceSchema schema) {
        EvidenceSource existing = evidence.get(ev.id());
        if (existing == null) {
            evidence.put(ev.id(), new EvidenceSource(ev.id(), ev.name(), schema, List.of(controlId)));
        } else if (!existing.referencedBy().contains(controlId)) {
            List<String> refs = new ArrayList<>(existing.referencedBy());
            refs.add(controlId);
            evidence.put(ev.id(), new EvidenceSource(existing.evidenceConfigId(), existing.evidenceName(), existing.schema(), refs));
        }
    }

    void markEvidenceFailed(String evidenceConfigId) { failedEvidence.add(evidenceConfigId); }

    /** Evidence ids already resolved or known to fail; workers skip schema reads for these. */
    Set<String> knownEvidence() {
        Set<String> known = new HashSet<>(evidence.keySet());
        known.addAll(failedEvidence);
        return Set.copyOf(known);
    }

    boolean isFailed(String evidenceConfigId) { return failedEvidence.contains(evidenceConfigId); }

    void truncate(String reason, Map<String, Object> details) {
        if (truncations.add(reason)) {
            findings.add(Finding.warn("TRAVERSAL_TRUNCATED", "Traversal from " + startId + " stopped early: " + reason, details));
        }
    }

    TraversalResult build() {
        List<Finding> out = new ArrayList<>(findings);
        if (evidence.isEmpty()) {
            out.add(Finding.ok("NO_EVIDENCE", "No evidence configurations are reachable from " + startId
                    + "; SQL synthesis has nothing to query.", Map.of("visited", visited.size())));
        }
        return new TraversalResult(startId,
                List.copyOf(visited.values()),
                Collections.unmodifiableMap(new LinkedHashMap<>(evidence)),
                List.copyOf(out),
                !truncations.isEmpty());
    }
}
