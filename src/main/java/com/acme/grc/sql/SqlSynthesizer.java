/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Policy Control Compiler
 */

package com.acme.grc.sql;

import com.acme.grc.model.*;
import com.acme.grc.model.Enums.JoinStrategy;
import com.acme.grc.model.Enums.QueryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Supplier;

/**
 * Turns the evidence reached by a traversal into two SQL artifacts: a selection query returning the scoped evidence
 * rows, and a summary query aggregating them into one compliance row per control context.
 *
 * <p>Both queries are built from the same row-source plan and predicate builder, but by separate calls, so a bad
 * field reference in one never stops the other from being produced.</p>
 */
public final class SqlSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(SqlSynthesizer.class);

    private final Dialect dialect;

    public SqlSynthesizer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public SynthesisResult synthesize(TraversalResult traversal, ControlScope control, AssessmentScope assessment) {
        ControlScope cs = control == null ? ControlScope.empty() : control;
        AssessmentScope as = assessment == null ? AssessmentScope.empty() : assessment;
        List<Finding> findings = new ArrayList<>();

        List<EvidenceSource> sources = new ArrayList<>();
        for (EvidenceSource s : traversal.sources()) {
            if (s.schema() == null || s.schema().fields().isEmpty()) {
                findings.add(Finding.warn("SCHEMA_RESOLUTION", "Evidence '" + s.evidenceName() + "' has no usable schema and is left out of the SQL.",
                        Map.of("evidenceConfigId", s.evidenceConfigId())));
            } else {
                sources.add(s);
            }
        }

        SourcePlan plan = SourcePlan.plan(sources, cs.groupBy(), dialect);
        log.info("Synthesizing SQL for {} over {} evidence table(s) using {}", traversal.startId(), sources.size(), plan.strategy());

        switch (plan.strategy()) {
            case NONE -> {
                Finding none = Finding.err("NO_EVIDENCE", "No evidence schema is reachable from " + traversal.startId() + "; nothing to query.");
                return new SynthesisResult(JoinStrategy.NONE,
                        QueryOutcome.failed(QueryKind.SELECTION, none),
                        QueryOutcome.failed(QueryKind.SUMMARY, none),
                        List.of(), findings);
            }
            case SEPARATE -> {
                Finding noKey = Finding.err("NO_SHARED_KEY",
                        "Evidence " + plan.tables() + " share no key field and are not union-compatible; no combined query is produced.",
                        Map.of("tables", plan.tables()));
                List<SqlQuery> perEvidence = new ArrayList<>();
                for (EvidenceSource s : sources) {
                    try {
                        perEvidence.add(selection(SourcePlan.single(s, dialect), cs, as));
                    } catch (IllegalArgumentException | UndefinedFieldReferenceException e) {
                        findings.add(Finding.err(categoryOf(e), "Selection for evidence '" + s.evidenceName() + "' skipped: " + e.getMessage(),
                                Map.of("evidenceConfigId", s.evidenceConfigId())));
                    }
                }
                return new SynthesisResult(JoinStrategy.SEPARATE,
                        QueryOutcome.failed(QueryKind.SELECTION, noKey),
                        QueryOutcome.failed(QueryKind.SUMMARY, noKey),
                        perEvidence, findings);
            }
            default -> {
                if (plan.strategy() == JoinStrategy.JOIN) {
                    findings.add(Finding.ok("SOURCE_STRATEGY", "Evidence joined on shared field '" + plan.joinKey() + "'.",
                            Map.of("tables", plan.tables(), "key", plan.joinKey())));
                }
                QueryOutcome selection = attempt(QueryKind.SELECTION, () -> selection(plan, cs, as));
                QueryOutcome summary = attempt(QueryKind.SUMMARY, () -> summary(plan, cs, as));
                return new SynthesisResult(plan.strategy(), selection, summary, List.of(), findings);
            }
        }
    }

    private QueryOutcome attempt(QueryKind kind, Supplier<SqlQuery> build) {
        try {
            SqlQuery q = build.get();
            log.debug("{} query:\n{}", kind, q.sql());
            return QueryOutcome.ok(q);
        } catch (UndefinedFieldReferenceException | IllegalArgumentException e) {
            log.warn("{} query not produced: {}", kind, e.getMessage());
            return QueryOutcome.failed(kind, Finding.err(categoryOf(e), e.getMessage(), Map.of("query", kind.name())));
        }
    }

    private static String categoryOf(RuntimeException e) {
        return e instanceof UndefinedFieldReferenceException ? "UNDEFINED_FIELD" : "INVALID_LITERAL";
    }

    SqlQuery selection(SourcePlan plan, ControlScope cs, AssessmentScope as) {
        Set<String> fields = new LinkedHashSet<>();
        List<SourcePlan.Column> projection = new ArrayList<>();
        if (cs.columns().isEmpty()) projection.addAll(plan.allColumns());
        else for (String c : cs.columns()) projection.add(plan.resolve(c));
        projection.forEach(c -> fields.add(c.name()));

        StringJoiner select = new StringJoiner(", ");
        projection.forEach(c -> select.add(c.expr()));

        String sql = "SELECT " + select + "\nFROM " + plan.from() + where(plan, cs, as, fields);
        return new SqlQuery(QueryKind.SELECTION, sql, plan.tables(), List.copyOf(fields));
    }

    SqlQuery summary(SourcePlan plan, ControlScope cs, AssessmentScope as) {
        Set<String> fields = new LinkedHashSet<>();
        List<SourcePlan.Column> groups = new ArrayList<>();
        for (String g : cs.groupBy()) groups.add(plan.resolve(g));
        groups.forEach(c -> fields.add(c.name()));

        String compliant;
        String nonCompliant;
        ComplianceCriterion criterion = cs.criterion();
        if (criterion != null) {
            SourcePlan.Column col = plan.resolve(criterion.field());
            fields.add(col.name());
            String test = predicate(col, criterion.expected());
            compliant = "SUM(CASE WHEN " + test + " THEN 1 ELSE 0 END)";
            nonCompliant = "SUM(CASE WHEN " + test + " THEN 0 ELSE 1 END)";
        } else {
            // without a criterion every scoped row is an exception
            compliant = "0";
            nonCompliant = "COUNT(*)";
        }

        StringJoiner select = new StringJoiner(",\n       ");
        groups.forEach(c -> select.add(c.expr()));
        select.add("COUNT(*) AS total_rows");
        select.add(compliant + " AS compliant_rows");
        select.add(nonCompliant + " AS non_compliant_rows");
        select.add("CASE WHEN " + nonCompliant + " = 0 THEN 'COMPLIANT' ELSE 'NON_COMPLIANT' END AS compliance_status");

        StringBuilder sql = new StringBuilder("SELECT ").append(select)
                .append("\nFROM ").append(plan.from())
                .append(where(plan, cs, as, fields));
        if (!groups.isEmpty()) {
            StringJoiner groupBy = new StringJoiner(", ");
            groups.forEach(c -> groupBy.add(c.expr()));
            sql.append("\nGROUP BY ").append(groupBy);
        }
        return new SqlQuery(QueryKind.SUMMARY, sql.toString(), plan.tables(), List.copyOf(fields));
    }

    /** Assessment filters first, then control filters. */
    private String where(SourcePlan plan, ControlScope cs, AssessmentScope as, Set<String> fields) {
        List<String> preds = new ArrayList<>();
        for (Map<String, String> filters : List.of(as.filters(), cs.filters())) {
            for (Map.Entry<String, String> e : filters.entrySet()) {
                SourcePlan.Column col = plan.resolve(e.getKey());
                fields.add(col.name());
                preds.add(predicate(col, e.getValue()));
            }
        }
        return preds.isEmpty() ? "" : "\nWHERE " + String.join("\n  AND ", preds);
    }

    private String predicate(SourcePlan.Column col, String value) {
        if (value == null) return col.expr() + " IS NULL";
        return col.expr() + " = " + literal(col, value);
    }

    String literal(SourcePlan.Column col, String value) {
        String v = value.strip();
        return switch (col.type()) {
            case NUMBER -> {
                try { yield new BigDecimal(v).toPlainString(); }
                catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Value '" + value + "' for numeric field '" + col.name() + "' is not a number");
                }
            }
            case BOOLEAN -> dialect.booleanLiteral(parseBoolean(col.name(), v));
            default -> dialect.stringLiteral(value);
        };
    }

    private static boolean parseBoolean(String field, String v) {
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "y", "1" -> true;
            case "false", "no", "n", "0" -> false;
            default -> throw new IllegalArgumentException("Value '" + v + "' for boolean field '" + field + "' is not a boolean");
        };
    }
}
