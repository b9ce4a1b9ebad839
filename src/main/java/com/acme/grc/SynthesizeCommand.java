package com.acme.grc;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.model.*;
import com.acme.grc.model.Enums.DbType;
import com.acme.grc.sql.Dialect;
import com.acme.grc.sql.JdbcSampleQueryExecutor;
import com.acme.grc.sql.SampleQueryExecutor;
import com.acme.grc.sql.SqlSynthesizer;
import com.acme.grc.util.DbUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "synthesize",
        mixinStandardHelpOptions = true,
        description = "Traces evidence from a control config and synthesizes a selection query and a compliance summary query.",
        sortOptions = false
)
public class SynthesizeCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SynthesizeCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    GraphOptions graph;

    @CommandLine.Option(names = "--control-filter", paramLabel = "FIELD=VALUE", description = "Control-level equality filter, repeatable.")
    Map<String, String> controlFilters = new LinkedHashMap<>();

    @CommandLine.Option(names = "--assessment-filter", paramLabel = "FIELD=VALUE", description = "Assessment-level equality filter, repeatable.")
    Map<String, String> assessmentFilters = new LinkedHashMap<>();

    @CommandLine.Option(names = "--group-by", split = ",", description = "Fields identifying one control context in the summary.")
    List<String> groupBy = new ArrayList<>();

    @CommandLine.Option(names = "--column", split = ",", description = "Columns of the selection query. Default: every evidence field.")
    List<String> columns = new ArrayList<>();

    @CommandLine.Option(names = "--criterion", paramLabel = "FIELD=VALUE", description = "A row is compliant when FIELD equals VALUE.")
    String criterion;

    @CommandLine.Option(names = "--db-type", defaultValue = "AUTO", description = "SQL dialect: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    DbType dbType;

    @CommandLine.Option(names = "--jdbc-url", description = "JDBC URL of the evidence database; enables sample previews.")
    String jdbcUrl;

    @CommandLine.Option(names = "--user", description = "DB username (read-only recommended).")
    String user;

    @CommandLine.Option(names = "--password", interactive = true, arity = "0..1", description = "DB password (interactive prompt recommended).")
    String password;

    @CommandLine.Option(names = "--sample-rows", description = "Preview rows per query, 1 to the configured maximum. Default from config (3).")
    Integer sampleRows;

    @CommandLine.Mixin
    CommonOptions common;

    @Override
    public Integer call() throws Exception {
        GrcSettings settings = common.settings(spec);
        ControlScope control = new ControlScope(controlFilters, groupBy, columns, parseCriterion());
        AssessmentScope assessment = new AssessmentScope(assessmentFilters);

        TraversalResult traversal = graph.traversal(spec, settings).traverse(graph.start);
        List<Finding> findings = new ArrayList<>(traversal.findings());

        SynthesisResult result;
        Map<String, Object> samples = new LinkedHashMap<>();
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            result = new SqlSynthesizer(new Dialect(dbType)).synthesize(traversal, control, assessment);
        } else {
            Properties props = new Properties();
            if (user != null) props.setProperty("user", user);
            if (password != null) props.setProperty("password", password);
            try (Connection conn = DriverManager.getConnection(jdbcUrl, props)) {
                DbType effective = dbType == DbType.AUTO ? DbUtil.detectDbType(conn) : dbType;
                Dialect dialect = new Dialect(effective);
                result = new SqlSynthesizer(dialect).synthesize(traversal, control, assessment);
                SampleQueryExecutor executor = new JdbcSampleQueryExecutor(conn, dialect, settings.samples);
                int rows = sampleRows == null ? settings.samples.defaultRows : sampleRows;
                for (QueryOutcome o : List.of(result.selection(), result.summary())) {
                    if (o.succeeded()) samples.put(o.kind().name().toLowerCase(Locale.ROOT), executor.preview(o.query(), rows));
                }
            } catch (SQLException e) {
                log.warn("Cannot connect to {}: {}", DbUtil.redactSecrets(jdbcUrl), e.getMessage());
                findings.add(Finding.warn("DATABASE", "Cannot connect via JDBC, no samples taken: " + e.getMessage()));
                result = new SqlSynthesizer(new Dialect(dbType)).synthesize(traversal, control, assessment);
            }
        }
        findings.addAll(result.findings());
        findings.addAll(outcomeErrors(result));

        Map<String, Object> report = Reports.envelope("synthesize", Reports.inputs(
                "graph", graph.graph.toString(),
                "start", graph.start,
                "db_type", String.valueOf(dbType),
                "jdbc_url_redacted", DbUtil.redactSecrets(jdbcUrl),
                "control_scope", control,
                "assessment_scope", assessment
        ));
        report.put("strategy", result.strategy().toString());
        report.put("tables", traversal.sources().stream().map(EvidenceSource::evidenceName).toList());
        report.put("selection", queryOut(result.selection()));
        report.put("summary", queryOut(result.summary()));
        if (!result.perEvidenceSelections().isEmpty()) report.put("per_evidence_selections", result.perEvidenceSelections());
        if (!samples.isEmpty()) report.put("samples", samples);
        report.put("findings", Reports.findingsOut(findings));
        Path written = Reports.write(report, common.out, "synthesize");

        System.out.println("\n=== Evidence SQL for " + graph.start + " (" + result.strategy() + ") ===");
        print("Selection query", result.selection());
        print("Summary query", result.summary());
        for (SqlQuery q : result.perEvidenceSelections()) {
            System.out.println("\n-- Selection for " + String.join(", ", q.tables()));
            System.out.println(q.sql() + ";");
        }
        System.out.println("\nReport: " + written + "\n");

        int failed = (result.selection().succeeded() ? 0 : 1) + (result.summary().succeeded() ? 0 : 1);
        return failed;
    }

    private ComplianceCriterion parseCriterion() {
        if (criterion == null || criterion.isBlank()) return null;
        int eq = criterion.indexOf('=');
        if (eq <= 0) throw new CommandLine.ParameterException(spec.commandLine(), "--criterion must be FIELD=VALUE, got: " + criterion);
        return new ComplianceCriterion(criterion.substring(0, eq).strip(), criterion.substring(eq + 1).strip());
    }

    /** Errors of the failed queries; one cause shared by both queries is reported once. */
    static List<Finding> outcomeErrors(SynthesisResult result) {
        Set<Finding> errors = new LinkedHashSet<>();
        for (QueryOutcome o : List.of(result.selection(), result.summary())) {
            if (!o.succeeded()) errors.add(o.error());
        }
        return List.copyOf(errors);
    }

    private static Map<String, Object> queryOut(QueryOutcome o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", o.succeeded());
        if (o.succeeded()) {
            m.put("sql", o.query().sql());
            m.put("tables", o.query().tables());
            m.put("fields", o.query().fields());
        } else {
            m.put("error", o.error().message());
        }
        return m;
    }

    private static void print(String title, QueryOutcome o) {
        System.out.println("\n-- " + title);
        if (o.succeeded()) System.out.println(o.query().sql() + ";");
        else System.out.println("-- not produced: " + o.error().message());
    }
}
