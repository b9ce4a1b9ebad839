package com.acme.grc;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.graph.ControlGraphTraversal;
import com.acme.grc.graph.SnapshotGraphReader;
import com.acme.grc.graph.TraversalLimits;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/** Graph source and traversal limits for commands that walk control links. */
public class GraphOptions {

    @CommandLine.Option(names = "--graph", required = true, description = "Graph snapshot (JSON or YAML) of control configs and evidence schemas.")
    Path graph;

    @CommandLine.Option(names = "--start", required = true, description = "Control config id to start from.")
    String start;

    @CommandLine.Option(names = "--max-depth", description = "Maximum link hops. Default from config (25).")
    Integer maxDepth;

    @CommandLine.Option(names = "--max-nodes", description = "Maximum control configs visited. Default from config (500).")
    Integer maxNodes;

    @CommandLine.Option(names = "--parallelism", description = "Worker threads per frontier level. Default from config (1).")
    Integer parallelism;

    TraversalLimits limits(GrcSettings settings) {
        GrcSettings.Traversal t = settings.traversal;
        return new TraversalLimits(
                maxDepth != null ? maxDepth : t.maxDepth,
                maxNodes != null ? maxNodes : t.maxNodes,
                parallelism != null ? parallelism : t.parallelism);
    }

    ControlGraphTraversal traversal(CommandLine.Model.CommandSpec spec, GrcSettings settings) {
        try {
            return new ControlGraphTraversal(SnapshotGraphReader.load(graph), limits(settings));
        } catch (IOException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot load --graph " + graph + ": " + e.getMessage(), e);
        }
    }
}
