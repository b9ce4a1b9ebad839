package com.acme.grc.graph;

import com.acme.grc.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Breadth-first, cycle-safe walk over control links that collects the evidence schemas every reachable control
 * depends on.
 *
 * <p>The walk is level-synchronous. Reads for one frontier level may run on worker threads, but only the calling
 * thread claims nodes and records evidence, merging each level in frontier order. Results are therefore identical
 * whatever the parallelism, and a node is processed at most once even when several branches reach it.</p>
 *
 * <p>Read failures are reported as findings against the branch that hit them; the rest of the graph is still
 * explored. Exceeding {@link TraversalLimits} stops the walk with a truncation warning and returns what was found.</p>
 */
public final class ControlGraphTraversal {
    private static final Logger log = LoggerFactory.getLogger(ControlGraphTraversal.class);

    private final ControlGraphReader reader;
    private final TraversalLimits limits;

    public ControlGraphTraversal(ControlGraphReader reader, TraversalLimits limits) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ControlGraphTraversal(ControlGraphReader reader) {
        this(reader, TraversalLimits.defaults());
    }

    /** Everything read for one node; produced by workers, consumed by the coordinator. */
    private record NodeReads(VisitedControl node, List<String> links, List<EvidenceConfig> evidenceConfigs,
                             Map<String, EvidenceSchema> schemas, Set<String> failedSchemas, List<Finding> findings) {}

    public TraversalResult traverse(String startId) {
        if (startId == null || startId.isBlank()) throw new IllegalArgumentException("controlConfigId is mandatory");
        String start = startId.strip();

        TraversalResultBuilder out = new TraversalResultBuilder(start);
        MdcAwareExecutor pool = limits.parallelism() > 1 ? new MdcAwareExecutor(limits.parallelism()) : null;
        MDC.put("controlId", start);
        try {
            VisitedControl root = new VisitedControl(start, 0, null);
            out.claim(root);
            List<VisitedControl> frontier = List.of(root);
            while (!frontier.isEmpty()) {
                List<NodeReads> level = readLevel(frontier, out.knownEvidence(), pool);
                frontier = merge(level, out);
            }
        } finally {
            MDC.remove("controlId");
            if (pool != null) pool.close();
        }

        TraversalResult result = out.build();
        log.info("Traversal from {} visited {} control config(s), resolved {} evidence schema(s){}",
                start, result.visited().size(), result.evidence().size(), result.truncated() ? " (truncated)" : "");
        return result;
    }

    private List<VisitedControl> merge(List<NodeReads> level, TraversalResultBuilder out) {
        List<VisitedControl> next = new ArrayList<>();
        for (NodeReads r : level) {
            String id = r.node().controlConfigId();
            r.findings().forEach(out::addFinding);

            for (EvidenceConfig ev : r.evidenceConfigs()) {
                EvidenceSchema schema = r.schemas().get(ev.id());
                if (schema != null) out.addEvidence(id, ev, schema);
                else if (r.failedSchemas().contains(ev.id())) out.markEvidenceFailed(ev.id());
                else if (!out.isFailed(ev.id())) out.addEvidence(id, ev, null);
            }

            for (String linked : r.links()) {
                if (linked == null || linked.isBlank() || out.isVisited(linked)) continue;
                int depth = r.node().depth() + 1;
                if (depth > limits.maxDepth()) {
                    out.truncate("depth limit " + limits.maxDepth() + " reached",
                            Map.of("maxDepth", limits.maxDepth(), "at", id));
                    continue;
                }
                if (out.visitedCount() >= limits.maxNodes()) {
                    out.truncate("node limit " + limits.maxNodes() + " reached",
                            Map.of("maxNodes", limits.maxNodes(), "at", id));
                    continue;
                }
                VisitedControl v = new VisitedControl(linked, depth, id);
                if (out.claim(v)) next.add(v);
            }
        }
        return next;
    }

    private List<NodeReads> readLevel(List<VisitedControl> frontier, Set<String> knownEvidence, MdcAwareExecutor pool) {
        if (pool == null || frontier.size() == 1) {
            List<NodeReads> reads = new ArrayList<>(frontier.size());
            for (VisitedControl v : frontier) reads.add(read(v, knownEvidence));
            return reads;
        }
        List<CompletableFuture<NodeReads>> futures = new ArrayList<>(frontier.size());
        for (VisitedControl v : frontier) futures.add(CompletableFuture.supplyAsync(() -> read(v, knownEvidence), pool));

        List<NodeReads> reads = new ArrayList<>(frontier.size());
        for (int i = 0; i < futures.size(); i++) {
            VisitedControl v = frontier.get(i);
            try {
                reads.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Reading control config {} failed", v.controlConfigId(), cause);
                reads.add(new NodeReads(v, List.of(), List.of(), Map.of(), Set.of(), List.of(
                        Finding.warn("GRAPH_READ", "Reading control config " + v.controlConfigId() + " failed: " + cause.getMessage(),
                                Map.of("controlConfigId", v.controlConfigId())))));
            }
        }
        return reads;
    }

    private NodeReads read(VisitedControl node, Set<String> knownEvidence) {
        String id = node.controlConfigId();
        List<Finding> findings = new ArrayList<>();

        List<String> links;
        try {
            links = nonNull(reader.linkedControls(id));
        } catch (GraphReadException | RuntimeException e) {
            log.warn("Cannot read control links of {}: {}", id, e.getMessage());
            findings.add(Finding.warn("GRAPH_READ", "Cannot read control links of " + id + ": " + e.getMessage(),
                    Map.of("controlConfigId", id)));
            links = List.of();
        }

        List<EvidenceConfig> evidenceConfigs;
        try {
            evidenceConfigs = nonNull(reader.evidenceConfigs(id));
        } catch (GraphReadException | RuntimeException e) {
            log.warn("Cannot read evidence configs of {}: {}", id, e.getMessage());
            findings.add(Finding.warn("GRAPH_READ", "Cannot read evidence configs of " + id + ": " + e.getMessage(),
                    Map.of("controlConfigId", id)));
            evidenceConfigs = List.of();
        }

        Map<String, EvidenceSchema> schemas = new HashMap<>();
        Set<String> failed = new HashSet<>();
        for (EvidenceConfig ev : evidenceConfigs) {
            if (knownEvidence.contains(ev.id()) || schemas.containsKey(ev.id()) || failed.contains(ev.id())) continue;
            String problem;
            try {
                Optional<EvidenceSchema> schema = reader.schemaFor(ev.id());
                if (schema.isPresent()) { schemas.put(ev.id(), schema.get()); continue; }
                problem = "no schema registered";
            } catch (GraphReadException | RuntimeException e) {
                problem = e.getMessage();
            }
            failed.add(ev.id());
            log.warn("Schema of evidence config {} ({}) linked from {} could not be resolved: {}", ev.id(), ev.name(), id, problem);
            findings.add(Finding.warn("SCHEMA_RESOLUTION",
                    "Schema of evidence config '" + ev.name() + "' could not be resolved: " + problem,
                    Map.of("evidenceConfigId", ev.id(), "controlConfigId", id)));
        }

        log.debug("Read {}: {} link(s), {} evidence config(s)", id, links.size(), evidenceConfigs.size());
        return new NodeReads(node, links, evidenceConfigs, schemas, failed, findings);
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
