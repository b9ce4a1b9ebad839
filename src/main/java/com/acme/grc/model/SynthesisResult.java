package com.acme.grc.model;

import com.acme.grc.model.Enums.JoinStrategy;

import java.util.List;

/**
 * Output of SQL synthesis. {@code selection} and {@code summary} are separate artifacts and may fail independently.
 * {@code perEvidenceSelections} is only populated for {@link JoinStrategy#SEPARATE}.
 */
public record SynthesisResult(
        JoinStrategy strategy,
        QueryOutcome selection,
        QueryOutcome summary,
        List<SqlQuery> perEvidenceSelections,
        List<Finding> findings
) {
    public SynthesisResult {
        perEvidenceSelections = perEvidenceSelections == null ? List.of() : List.copyOf(perEvidenceSelections);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
