package com.acme.grc;

import com.acme.grc.hierarchy.AssessmentDocuments;
import com.acme.grc.model.Assessment;
import com.acme.grc.util.MapperUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyControlAppTest {

    private static final String MFA_POLICY = """
            Remote Access
            The organization must enforce MFA for all remote access and administrative accounts.
            For example, staff must use the corporate authenticator app.
            """;

    @TempDir
    Path dir;

    private static int run(String... args) {
        return new CommandLine(new PolicyControlApp()).execute(args);
    }

    private static Path graph() throws Exception {
        return Path.of(PolicyControlAppTest.class.getResource("/graphs/login-cycle.yaml").toURI());
    }

    private JsonNode report(Path p) throws Exception {
        return MapperUtil.JSON.readTree(p.toFile());
    }

    private Path compileMfa() throws Exception {
        Path policy = Files.writeString(dir.resolve("remote-access.md"), MFA_POLICY);
        Path yaml = dir.resolve("assessment.yaml");
        assertThat(run("compile", policy.toString(), "--yaml", yaml.toString(), "--out", dir.resolve("compile.json").toString()))
                .isZero();
        return yaml;
    }

    @Nested
    @DisplayName("compile")
    class Compile {

        @Test
        @DisplayName("should write the assessment YAML and a report")
        void compilesPolicy() throws Exception {
            Path yaml = compileMfa();

            Assessment a = AssessmentDocuments.read(yaml);
            assertThat(a.name()).isEqualTo("remote-access");
            assertThat(a.categoryName()).isEqualTo("Access Management");
            assertThat(a.flatten()).hasSize(3);

            JsonNode r = report(dir.resolve("compile.json"));
            assertThat(r.path("tool").path("command").asText()).isEqualTo("compile");
            assertThat(r.path("requirements").size()).isEqualTo(2);
            assertThat(r.path("findings").get(0).path("severity").asText()).isEqualTo("OK");
        }

        @Test
        @DisplayName("a document without requirements exits with 3")
        void extractionEmpty() throws Exception {
            Path policy = Files.writeString(dir.resolve("empty.txt"), "This document describes our approach.");
            Path out = dir.resolve("r.json");

            assertThat(run("compile", policy.toString(), "--out", out.toString())).isEqualTo(3);
            assertThat(report(out).path("findings").get(0).path("category").asText()).isEqualTo("EXTRACTION_EMPTY");
        }

        @Test
        @DisplayName("a missing policy file is a usage error")
        void missingPolicy() {
            assertThat(run("compile", dir.resolve("absent.md").toString())).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("trace and synthesize")
    class Graph {

        @Test
        @DisplayName("trace should follow the cycle once and report both evidence tables")
        void trace() throws Exception {
            Path out = dir.resolve("trace.json");

            assertThat(run("trace", "--graph", graph().toString(), "--start", "ctl-mfa", "--out", out.toString())).isZero();

            JsonNode r = report(out);
            assertThat(r.path("visited").size()).isEqualTo(2);
            assertThat(r.path("evidence").get(1).path("evidenceName").asText()).isEqualTo("LoginEvents");
            assertThat(r.path("truncated").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("synthesize should join on the shared key and emit both queries")
        void synthesize() throws Exception {
            Path out = dir.resolve("sql.json");

            int exit = run("synthesize", "--graph", graph().toString(), "--start", "ctl-mfa",
                    "--control-filter", "department=IT", "--group-by", "user", "--criterion", "mfa_used=true",
                    "--out", out.toString());

            assertThat(exit).isZero();
            JsonNode r = report(out);
            assertThat(r.path("strategy").asText()).isEqualTo("JOIN");
            assertThat(r.path("selection").path("sql").asText()).contains("JOIN \"LoginEvents\" t2");
            assertThat(r.path("summary").path("sql").asText()).contains("compliance_status");
        }

        @Test
        @DisplayName("an undefined group-by field fails one query and exits with 1")
        void oneQueryFails() throws Exception {
            Path out = dir.resolve("sql.json");

            int exit = run("synthesize", "--graph", graph().toString(), "--start", "ctl-mfa",
                    "--group-by", "region", "--out", out.toString());

            assertThat(exit).isEqualTo(1);
            JsonNode r = report(out);
            assertThat(r.path("selection").path("ok").asBoolean()).isTrue();
            assertThat(r.path("summary").path("ok").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("a cause shared by both failed queries is reported once")
        void sharedFailureReportedOnce() throws Exception {
            Path out = dir.resolve("sql.json");

            int exit = run("synthesize", "--graph", graph().toString(), "--start", "ctl-unknown", "--out", out.toString());

            assertThat(exit).isEqualTo(2);
            int errors = 0;
            for (JsonNode f : report(out).path("findings")) {
                if (f.path("severity").asText().equals("ERROR") && f.path("category").asText().equals("NO_EVIDENCE")) errors++;
            }
            assertThat(errors).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("rollup")
    class Rollup {

        @Test
        @DisplayName("a failing leaf makes the assessment non-compliant")
        void nonCompliant() throws Exception {
            Path yaml = compileMfa();
            Path out = dir.resolve("rollup.json");

            int exit = run("rollup", "--assessment", yaml.toString(), "--state", "1.1=COMPLIANT", "--state", "1.2=FAIL",
                    "--out", out.toString());

            assertThat(exit).isEqualTo(2);
            JsonNode r = report(out);
            assertThat(r.path("overall").asText()).isEqualTo("NON_COMPLIANT");
            assertThat(r.path("controls").path("1").asText()).isEqualTo("NON_COMPLIANT");
        }

        @Test
        @DisplayName("compliant leaves read from a states file roll up to compliant")
        void compliantFromFile() throws Exception {
            Path yaml = compileMfa();
            Path states = Files.writeString(dir.resolve("states.yaml"), "\"1.1\": COMPLIANT\n\"1.2\": pass\n");

            int exit = run("rollup", "--assessment", yaml.toString(), "--states", states.toString(),
                    "--out", dir.resolve("rollup.json").toString());

            assertThat(exit).isZero();
        }
    }
}
