package com.acme.grc.model;

import com.acme.grc.model.Enums.ComplianceState;

import java.util.Map;

/** Per-alias compliance states in depth-first order, plus the assessment's overall state. */
public record RollupResult(ComplianceState overall, Map<String, ComplianceState> states) {
    public ComplianceState stateOf(String alias) {
        return states.getOrDefault(alias, ComplianceState.UNEVALUATED);
    }
}
