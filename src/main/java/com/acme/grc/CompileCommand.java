package com.acme.grc;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.extract.ExtractionEmptyException;
import com.acme.grc.extract.RequirementExtractor;
import com.acme.grc.hierarchy.AliasCollisionException;
import com.acme.grc.hierarchy.AssessmentDocuments;
import com.acme.grc.hierarchy.HierarchyBuilder;
import com.acme.grc.model.*;
import com.acme.grc.util.FsUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        description = "Extracts requirements from a policy document and writes the control hierarchy as an assessment YAML.",
        sortOptions = false
)
public class CompileCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_EXTRACTION_EMPTY = 3;
    static final int EXIT_ALIAS_COLLISION = 4;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    CommonOptions common;

    @CommandLine.Parameters(index = "0", paramLabel = "POLICY", description = "Policy document (plain text or markdown).")
    Path policy;

    @CommandLine.Option(names = "--name", description = "Assessment name. Default: the policy file name.")
    String name;

    @CommandLine.Option(names = "--description", description = "Assessment description.")
    String description;

    @CommandLine.Option(names = "--category", description = "Category name; skips keyword classification.")
    String category;

    @CommandLine.Option(names = "--hint", paramLabel = "THEME=KW[,KW...]",
            description = "Theme hint, repeatable. Requirements mentioning a keyword are grouped under the first matching theme.")
    Map<String, String> hints = new LinkedHashMap<>();

    @CommandLine.Option(names = "--yaml", description = "Assessment YAML output path. Default: printed to stdout.")
    Path yamlOut;

    @Override
    public Integer call() throws Exception {
        GrcSettings settings = common.settings(spec);

        String text;
        try {
            text = FsUtil.readDocument(policy);
        } catch (IOException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read policy " + policy + ": " + e.getMessage(), e);
        }
        String assessmentName = (name != null && !name.isBlank()) ? name : FsUtil.baseName(policy);

        Map<String, Object> report = Reports.envelope("compile", Reports.inputs(
                "policy", FsUtil.fileStat(policy.toString()),
                "name", assessmentName,
                "category", category,
                "hints", hints,
                "config", common.config == null ? null : common.config.toString()
        ));

        List<Finding> findings = new ArrayList<>();
        int exit;
        try {
            List<Requirement> requirements = new RequirementExtractor(settings).extract(text);
            Assessment a = new HierarchyBuilder(settings).build(assessmentName, description, category, requirements, themeHints());

            String yaml = AssessmentDocuments.toYaml(a);
            if (yamlOut != null) AssessmentDocuments.write(a, yamlOut);

            report.put("requirements", requirements);
            report.put("assessment", Map.of(
                    "name", a.name(),
                    "categoryName", a.categoryName(),
                    "controls", a.flatten().size(),
                    "yaml", yamlOut == null ? "stdout" : yamlOut.toString()
            ));
            findings.add(Finding.ok("COMPILE", "Compiled " + requirements.size() + " requirement(s) into " + a.flatten().size() + " control(s).",
                    Map.of("category", a.categoryName())));

            if (yamlOut == null) System.out.println(yaml);
            else System.out.println("Assessment: " + yamlOut + " (" + a.categoryName() + ", " + a.flatten().size() + " controls)");
            exit = 0;
        } catch (ExtractionEmptyException e) {
            log.warn("No requirements extracted from {}", policy);
            findings.add(Finding.err("EXTRACTION_EMPTY", e.getMessage(), Map.of("policy", policy.toString())));
            exit = EXIT_EXTRACTION_EMPTY;
        } catch (AliasCollisionException e) {
            log.error("Hierarchy rejected: {}", e.getMessage());
            findings.add(Finding.err("ALIAS_COLLISION", e.getMessage(), Map.of("alias", String.valueOf(e.alias()))));
            exit = EXIT_ALIAS_COLLISION;
        }

        report.put("findings", Reports.findingsOut(findings));
        Path written = Reports.write(report, common.out, "compile");
        System.err.println("Report: " + written);
        return exit;
    }

    private List<ThemeHint> themeHints() {
        List<ThemeHint> out = new ArrayList<>();
        for (Map.Entry<String, String> e : hints.entrySet()) {
            List<String> keywords = new ArrayList<>();
            for (String k : e.getValue().split(",")) if (!k.isBlank()) keywords.add(k.strip());
            out.add(new ThemeHint(e.getKey().strip(), keywords));
        }
        return out;
    }
}
