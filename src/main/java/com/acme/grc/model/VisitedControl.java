package com.acme.grc.model;

/**
 * Lineage entry for a traversed control config.
 *
 * @param linkedFrom the control whose link led here, null for the start node
 */
public record VisitedControl(String controlConfigId, int depth, String linkedFrom) {}
