package com.acme.grc.sql;

import com.acme.grc.model.*;
import com.acme.grc.model.Enums.DbType;
import com.acme.grc.model.Enums.FieldType;
import com.acme.grc.model.Enums.JoinStrategy;
import com.acme.grc.model.Enums.QueryKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SqlSynthesizerTest {

    static final EvidenceSchema LOGIN = new EvidenceSchema("ev-login", List.of(
            SchemaField.key("user", FieldType.TEXT),
            SchemaField.of("timestamp", FieldType.TIMESTAMP),
            SchemaField.of("mfa_used", FieldType.BOOLEAN)));
    static final EvidenceSchema VPN = new EvidenceSchema("ev-vpn", LOGIN.fields());
    static final EvidenceSchema ACCOUNTS = new EvidenceSchema("ev-accounts", List.of(
            SchemaField.key("user", FieldType.TEXT),
            SchemaField.of("department", FieldType.TEXT),
            SchemaField.of("failed_attempts", FieldType.NUMBER)));
    static final EvidenceSchema AUDIT = new EvidenceSchema("ev-app-audit", List.of(
            SchemaField.of("actor", FieldType.TEXT),
            SchemaField.of("action", FieldType.TEXT)));
    static final EvidenceSchema DB_AUDIT = new EvidenceSchema("ev-db-audit", AUDIT.fields());
    static final EvidenceSchema BADGES = new EvidenceSchema("ev-badges", List.of(
            SchemaField.key("badge_id", FieldType.NUMBER),
            SchemaField.of("door", FieldType.TEXT)));

    static EvidenceSource source(String name, EvidenceSchema schema) {
        return new EvidenceSource(schema.evidenceConfigId(), name, schema, List.of("ctl-1"));
    }

    static TraversalResult traversal(EvidenceSource... sources) {
        Map<String, EvidenceSource> evidence = new LinkedHashMap<>();
        for (EvidenceSource s : sources) evidence.put(s.evidenceConfigId(), s);
        return new TraversalResult("ctl-1", List.of(new VisitedControl("ctl-1", 0, null)), evidence, List.of(), false);
    }

    static ControlScope scope(Map<String, String> filters, List<String> groupBy, ComplianceCriterion criterion) {
        return new ControlScope(filters, groupBy, List.of(), criterion);
    }

    private final SqlSynthesizer ansi = new SqlSynthesizer(new Dialect(DbType.ANSI));

    @Nested
    @DisplayName("Single evidence")
    class Single {

        @Test
        @DisplayName("should select every field and filter on the control scope")
        void selection() {
            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)),
                    scope(Map.of("user", "alice"), List.of(), null), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.SINGLE);
            assertThat(r.selection().succeeded()).isTrue();
            assertThat(r.selection().query().sql()).isEqualTo(
                    "SELECT \"user\", \"timestamp\", \"mfa_used\"\nFROM \"LoginEvents\"\nWHERE \"user\" = 'alice'");
            assertThat(r.selection().query().tables()).containsExactly("LoginEvents");
        }

        @Test
        @DisplayName("summary should count compliant rows per group using the criterion")
        void summaryWithCriterion() {
            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)),
                    scope(Map.of(), List.of("user"), new ComplianceCriterion("mfa_used", "true")), AssessmentScope.empty());

            String sql = r.summary().query().sql();
            assertThat(sql).startsWith("SELECT \"user\",");
            assertThat(sql).contains(
                    "COUNT(*) AS total_rows",
                    "SUM(CASE WHEN \"mfa_used\" = TRUE THEN 1 ELSE 0 END) AS compliant_rows",
                    "SUM(CASE WHEN \"mfa_used\" = TRUE THEN 0 ELSE 1 END) AS non_compliant_rows",
                    "CASE WHEN SUM(CASE WHEN \"mfa_used\" = TRUE THEN 0 ELSE 1 END) = 0 THEN 'COMPLIANT' ELSE 'NON_COMPLIANT' END AS compliance_status");
            assertThat(sql).endsWith("GROUP BY \"user\"");
            assertThat(r.summary().query().fields()).containsExactly("user", "mfa_used");
        }

        @Test
        @DisplayName("without a criterion every scoped row is non-compliant")
        void summaryWithoutCriterion() {
            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)),
                    scope(Map.of(), List.of("user"), null), AssessmentScope.empty());

            assertThat(r.summary().query().sql()).contains("0 AS compliant_rows", "COUNT(*) AS non_compliant_rows");
        }

        @Test
        @DisplayName("assessment filters come before control filters")
        void filterOrder() {
            SynthesisResult r = ansi.synthesize(traversal(source("Accounts", ACCOUNTS)),
                    scope(Map.of("user", "alice"), List.of(), null), new AssessmentScope(Map.of("department", "IT")));

            assertThat(r.selection().query().sql()).endsWith("WHERE \"department\" = 'IT'\n  AND \"user\" = 'alice'");
        }

        @Test
        @DisplayName("literals follow the field type")
        void literals() {
            Map<String, String> filters = new LinkedHashMap<>();
            filters.put("failed_attempts", "3");
            filters.put("user", "o'brien");
            SynthesisResult r = ansi.synthesize(traversal(source("Accounts", ACCOUNTS)),
                    scope(filters, List.of(), null), AssessmentScope.empty());

            assertThat(r.selection().query().sql()).contains("\"failed_attempts\" = 3", "\"user\" = 'o''brien'");
        }

        @Test
        @DisplayName("a non-numeric value for a numeric field fails the query")
        void badNumber() {
            SynthesisResult r = ansi.synthesize(traversal(source("Accounts", ACCOUNTS)),
                    scope(Map.of("failed_attempts", "many"), List.of(), null), AssessmentScope.empty());

            assertThat(r.selection().succeeded()).isFalse();
            assertThat(r.selection().error().category()).isEqualTo("INVALID_LITERAL");
        }
    }

    @Nested
    @DisplayName("Combining several evidence tables")
    class Combining {

        @Test
        @DisplayName("a shared KEY field should produce a join on that key")
        void joinOnSharedKey() {
            SynthesisResult r = ansi.synthesize(
                    traversal(source("Accounts", ACCOUNTS), source("LoginEvents", LOGIN)),
                    scope(Map.of("department", "IT"), List.of("user"), new ComplianceCriterion("mfa_used", "yes")),
                    AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.JOIN);
            assertThat(r.selection().query().sql())
                    .contains("FROM \"Accounts\" t1 JOIN \"LoginEvents\" t2 ON t1.\"user\" = t2.\"user\"")
                    .contains("WHERE t1.\"department\" = 'IT'");
            assertThat(r.summary().query().sql()).contains("t2.\"mfa_used\" = TRUE", "GROUP BY t1.\"user\"");
            assertThat(r.selection().query().tables()).containsExactly("Accounts", "LoginEvents");
        }

        @Test
        @DisplayName("identical schemas without a KEY field should be unioned with a source column")
        void unionOfIdenticalSchemas() {
            SynthesisResult r = ansi.synthesize(
                    traversal(source("AppAudit", AUDIT), source("DbAudit", DB_AUDIT)),
                    ControlScope.empty(), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.UNION);
            assertThat(r.selection().query().sql()).contains(
                    "SELECT \"actor\", \"action\", 'AppAudit' AS evidence_source FROM \"AppAudit\"",
                    " UNION ALL ",
                    "'DbAudit' AS evidence_source FROM \"DbAudit\") u");
            assertThat(r.selection().query().fields()).endsWith("evidence_source");
        }

        @Test
        @DisplayName("identical schemas sharing a KEY field should join on it rather than union")
        void sharedKeyWinsOverUnion() {
            SynthesisResult r = ansi.synthesize(
                    traversal(source("LoginEvents", LOGIN), source("VpnLogins", VPN)),
                    ControlScope.empty(), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.JOIN);
            assertThat(r.selection().query().sql())
                    .contains("FROM \"LoginEvents\" t1 JOIN \"VpnLogins\" t2 ON t1.\"user\" = t2.\"user\"")
                    .doesNotContain("UNION");
        }

        @Test
        @DisplayName("without a shared key no join is fabricated")
        void separateWhenNothingShared() {
            SynthesisResult r = ansi.synthesize(
                    traversal(source("Badges", BADGES), source("LoginEvents", LOGIN)),
                    ControlScope.empty(), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.SEPARATE);
            assertThat(r.selection().succeeded()).isFalse();
            assertThat(r.summary().succeeded()).isFalse();
            assertThat(r.selection().error().category()).isEqualTo("NO_SHARED_KEY");
            assertThat(r.perEvidenceSelections()).extracting(SqlQuery::sql).containsExactly(
                    "SELECT \"badge_id\", \"door\"\nFROM \"Badges\"",
                    "SELECT \"user\", \"timestamp\", \"mfa_used\"\nFROM \"LoginEvents\"");
            assertThat(r.perEvidenceSelections()).noneMatch(q -> q.sql().contains("JOIN"));
        }

        @Test
        @DisplayName("a shared group-by field is used when no KEY is shared")
        void joinOnGroupByField() {
            EvidenceSchema left = new EvidenceSchema("ev-l", List.of(
                    SchemaField.of("host", FieldType.TEXT), SchemaField.of("patched", FieldType.BOOLEAN)));
            EvidenceSchema right = new EvidenceSchema("ev-r", List.of(
                    SchemaField.of("host", FieldType.TEXT), SchemaField.of("owner", FieldType.TEXT)));

            SynthesisResult r = ansi.synthesize(traversal(source("Patches", left), source("Hosts", right)),
                    scope(Map.of(), List.of("host"), null), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.JOIN);
            assertThat(r.selection().query().sql()).contains("ON t1.\"host\" = t2.\"host\"");
        }

        @Test
        @DisplayName("no reachable evidence yields no queries")
        void nothingToQuery() {
            SynthesisResult r = ansi.synthesize(traversal(), ControlScope.empty(), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.NONE);
            assertThat(r.selection().error().category()).isEqualTo("NO_EVIDENCE");
            assertThat(r.summary().succeeded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Independent artifacts")
    class Independence {

        @Test
        @DisplayName("an undefined group-by field fails only the summary")
        void undefinedGroupBy() {
            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)),
                    scope(Map.of(), List.of("region"), null), AssessmentScope.empty());

            assertThat(r.selection().succeeded()).isTrue();
            assertThat(r.summary().succeeded()).isFalse();
            assertThat(r.summary().kind()).isEqualTo(QueryKind.SUMMARY);
            assertThat(r.summary().error().category()).isEqualTo("UNDEFINED_FIELD");
            assertThat(r.summary().error().message()).contains("region");
        }

        @Test
        @DisplayName("an undefined projected column fails only the selection")
        void undefinedColumn() {
            ControlScope cs = new ControlScope(Map.of(), List.of("user"), List.of("user", "ip_address"), null);

            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)), cs, AssessmentScope.empty());

            assertThat(r.selection().succeeded()).isFalse();
            assertThat(r.selection().error().category()).isEqualTo("UNDEFINED_FIELD");
            assertThat(r.summary().succeeded()).isTrue();
        }

        @Test
        @DisplayName("an undefined filter field fails both queries")
        void undefinedFilter() {
            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN)),
                    scope(Map.of("tenant", "acme"), List.of(), null), AssessmentScope.empty());

            assertThat(r.selection().succeeded()).isFalse();
            assertThat(r.summary().succeeded()).isFalse();
        }

        @Test
        @DisplayName("evidence without a schema is left out with a warning")
        void missingSchema() {
            EvidenceSource noSchema = new EvidenceSource("ev-x", "Unknown", null, List.of("ctl-1"));

            SynthesisResult r = ansi.synthesize(traversal(source("LoginEvents", LOGIN), noSchema),
                    ControlScope.empty(), AssessmentScope.empty());

            assertThat(r.strategy()).isEqualTo(JoinStrategy.SINGLE);
            assertThat(r.findings()).extracting(Finding::category).containsExactly("SCHEMA_RESOLUTION");
        }
    }

    @Test
    @DisplayName("SQL Server dialect uses bracket quoting and numeric booleans")
    void sqlServerDialect() {
        SynthesisResult r = new SqlSynthesizer(new Dialect(DbType.SQLSERVER)).synthesize(
                traversal(source("LoginEvents", LOGIN)),
                scope(Map.of("mfa_used", "false"), List.of(), null), AssessmentScope.empty());

        assertThat(r.selection().query().sql()).isEqualTo(
                "SELECT [user], [timestamp], [mfa_used]\nFROM [LoginEvents]\nWHERE [mfa_used] = 0");
    }
}
