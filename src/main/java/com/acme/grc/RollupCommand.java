package com.acme.grc;

import com.acme.grc.hierarchy.AliasCollisionException;
import com.acme.grc.hierarchy.AssessmentDocuments;
import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.model.Enums.ComplianceState;
import com.acme.grc.model.Finding;
import com.acme.grc.model.RollupResult;
import com.acme.grc.rollup.ComplianceRollup;
import com.acme.grc.util.MapperUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "rollup",
        mixinStandardHelpOptions = true,
        description = "Folds leaf compliance states up an assessment hierarchy.",
        sortOptions = false
)
public class RollupCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--assessment", required = true, description = "Assessment YAML produced by 'compile'.")
    Path assessmentFile;

    @CommandLine.Option(names = "--states", description = "JSON or YAML map of leaf alias to status (COMPLIANT, NON_COMPLIANT, ...).")
    Path statesFile;

    @CommandLine.Option(names = "--state", paramLabel = "ALIAS=STATUS", description = "Leaf status, repeatable; overrides --states.")
    Map<String, String> states = new LinkedHashMap<>();

    @CommandLine.Mixin
    CommonOptions common;

    @Override
    public Integer call() throws Exception {
        Assessment a;
        try {
            a = AssessmentDocuments.read(assessmentFile);
        } catch (IOException | IllegalArgumentException | AliasCollisionException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read --assessment " + assessmentFile + ": " + e.getMessage(), e);
        }

        Map<String, String> raw = new LinkedHashMap<>();
        if (statesFile != null) {
            try {
                raw.putAll(MapperUtil.forFile(statesFile.toString()).readValue(statesFile.toFile(), new TypeReference<Map<String, String>>() {}));
            } catch (IOException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read --states " + statesFile + ": " + e.getMessage(), e);
            }
        }
        raw.putAll(states);

        Set<String> leafAliases = new HashSet<>();
        for (Control c : a.flatten()) if (c.isLeaf()) leafAliases.add(c.alias());

        List<Finding> findings = new ArrayList<>();
        Map<String, ComplianceState> leafStates = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            if (!leafAliases.contains(e.getKey())) {
                findings.add(Finding.warn("ROLLUP", "Status given for '" + e.getKey() + "', which is not a leaf control; ignored."));
                continue;
            }
            ComplianceState s = ComplianceRollup.parseStatus(e.getValue());
            if (s == ComplianceState.UNEVALUATED && e.getValue() != null && !e.getValue().isBlank()) {
                findings.add(Finding.warn("ROLLUP", "Unrecognised status '" + e.getValue() + "' for " + e.getKey() + "; treated as UNEVALUATED."));
            }
            leafStates.put(e.getKey(), s);
        }

        RollupResult result = ComplianceRollup.evaluate(a, leafStates);

        Map<String, Object> report = Reports.envelope("rollup", Reports.inputs(
                "assessment", assessmentFile.toString(),
                "states_file", statesFile == null ? null : statesFile.toString(),
                "leaf_states", leafStates
        ));
        report.put("assessment", Map.of("name", a.name(), "categoryName", a.categoryName()));
        report.put("overall", result.overall().toString());
        report.put("controls", result.states());
        report.put("findings", Reports.findingsOut(findings));
        Path written = Reports.write(report, common.out, "rollup");

        System.out.println("\n=== Compliance rollup: " + a.name() + " ===");
        for (Control c : a.flatten()) {
            System.out.println(c.alias() + "  " + c.name() + "  " + result.stateOf(c.alias()));
        }
        System.out.println("Overall: " + result.overall());
        System.out.println("Report: " + written + "\n");

        return switch (result.overall()) {
            case COMPLIANT -> 0;
            case UNEVALUATED -> 1;
            case NON_COMPLIANT -> 2;
        };
    }
}
