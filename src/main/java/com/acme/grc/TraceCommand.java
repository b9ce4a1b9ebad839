package com.acme.grc;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.model.Enums.Severity;
import com.acme.grc.model.EvidenceSource;
import com.acme.grc.model.TraversalResult;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "trace",
        mixinStandardHelpOptions = true,
        description = "Walks control links from a control config and lists every evidence schema it depends on.",
        sortOptions = false
)
public class TraceCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    GraphOptions graph;

    @CommandLine.Mixin
    CommonOptions common;

    @Override
    public Integer call() throws Exception {
        GrcSettings settings = common.settings(spec);
        TraversalResult result = graph.traversal(spec, settings).traverse(graph.start);

        Map<String, Object> report = Reports.envelope("trace", Reports.inputs(
                "graph", graph.graph.toString(),
                "start", graph.start,
                "limits", graph.limits(settings)
        ));
        report.put("visited", result.visited());
        report.put("evidence", result.sources());
        report.put("truncated", result.truncated());
        report.put("findings", Reports.findingsOut(result.findings()));
        Path written = Reports.write(report, common.out, "trace");

        System.out.println("\n=== Control link trace from " + result.startId() + " ===");
        System.out.println("Visited: " + String.join(" -> ", result.visitedIds()));
        for (EvidenceSource s : result.sources()) {
            int fields = s.schema() == null ? 0 : s.schema().fields().size();
            System.out.println("Evidence: " + s.evidenceName() + " (" + fields + " fields) <- " + String.join(", ", s.referencedBy()));
        }
        if (result.truncated()) System.out.println("Traversal truncated; see findings.");
        System.out.println("Report: " + written + "\n");

        Severity worst = Reports.worst(result.findings());
        return worst == Severity.OK ? 0 : (worst == Severity.WARN ? 1 : 2);
    }
}
