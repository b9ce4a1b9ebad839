package com.acme.grc.rollup;

import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.model.Enums.ComplianceState;
import com.acme.grc.model.RollupResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds leaf compliance states up the assessment tree. Side-effect free; every call recomputes from the
 * supplied leaf states.
 */
public final class ComplianceRollup {
    private ComplianceRollup() {}

    public static RollupResult evaluate(Assessment a, Map<String, ComplianceState> leafStates) {
        Map<String, ComplianceState> leaves = leafStates == null ? Map.of() : leafStates;
        Map<String, ComplianceState> states = new LinkedHashMap<>();
        ComplianceState overall = combine(a.planControls(), leaves, states);
        return new RollupResult(overall, Collections.unmodifiableMap(states));
    }

    private static ComplianceState combine(List<Control> controls, Map<String, ComplianceState> leaves,
                                           Map<String, ComplianceState> out) {
        if (controls.isEmpty()) return ComplianceState.UNEVALUATED;
        ComplianceState acc = ComplianceState.COMPLIANT;
        for (Control c : controls) acc = worst(acc, stateOf(c, leaves, out));
        return acc;
    }

    private static ComplianceState stateOf(Control c, Map<String, ComplianceState> leaves, Map<String, ComplianceState> out) {
        ComplianceState s;
        if (c.isLeaf()) {
            s = leaves.getOrDefault(c.alias(), ComplianceState.UNEVALUATED);
            out.put(c.alias(), s);
        } else {
            // reserve the pre-order slot before the children are added
            out.put(c.alias(), ComplianceState.UNEVALUATED);
            s = combine(c.planControls(), leaves, out);
            out.put(c.alias(), s);
        }
        return s;
    }

    /** NON_COMPLIANT dominates, then UNEVALUATED; COMPLIANT only when both are. */
    public static ComplianceState worst(ComplianceState a, ComplianceState b) {
        if (a == ComplianceState.NON_COMPLIANT || b == ComplianceState.NON_COMPLIANT) return ComplianceState.NON_COMPLIANT;
        if (a == ComplianceState.UNEVALUATED || b == ComplianceState.UNEVALUATED) return ComplianceState.UNEVALUATED;
        return ComplianceState.COMPLIANT;
    }

    /**
     * Maps a compliance-summary status value ("COMPLIANT", "non_compliant", "Non-Compliant", ...) to a state.
     * Anything unrecognised is UNEVALUATED.
     */
    public static ComplianceState parseStatus(String status) {
        if (status == null) return ComplianceState.UNEVALUATED;
        String s = status.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (s) {
            case "COMPLIANT", "PASS", "PASSED" -> ComplianceState.COMPLIANT;
            case "NON_COMPLIANT", "NONCOMPLIANT", "FAIL", "FAILED" -> ComplianceState.NON_COMPLIANT;
            default -> ComplianceState.UNEVALUATED;
        };
    }
}
