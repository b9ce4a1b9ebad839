package com.acme.grc.model;

import java.util.List;
import java.util.Map;

/**
 * Closed set of control configs reachable from {@code startId} and the evidence they depend on.
 * Both {@code visited} and {@code evidence} are in discovery order.
 */
public record TraversalResult(
        String startId,
        List<VisitedControl> visited,
        Map<String, EvidenceSource> evidence,
        List<Finding> findings,
        boolean truncated
) {
    public List<String> visitedIds() {
        return visited.stream().map(VisitedControl::controlConfigId).toList();
    }

    public List<EvidenceSource> sources() {
        return List.copyOf(evidence.values());
    }
}
