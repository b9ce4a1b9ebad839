package com.acme.grc.graph;

import com.acme.grc.graph.GraphSnapshot.EvidenceEntry;
import com.acme.grc.model.ControlConfig;
import com.acme.grc.model.EvidenceConfig;
import com.acme.grc.model.EvidenceSchema;
import com.acme.grc.util.MapperUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * {@link ControlGraphReader} over an in-memory {@link GraphSnapshot}. Unknown ids read as empty.
 */
public final class SnapshotGraphReader implements ControlGraphReader {

    private final Map<String, ControlConfig> controls = new HashMap<>();
    private final Map<String, EvidenceEntry> evidence = new HashMap<>();

    public SnapshotGraphReader(GraphSnapshot snapshot) {
        for (ControlConfig c : snapshot.controlConfigs()) {
            if (c.id() == null || c.id().isBlank()) throw new IllegalArgumentException("Control config without id in graph snapshot");
            if (controls.putIfAbsent(c.id(), c) != null) throw new IllegalArgumentException("Duplicate control config id " + c.id());
        }
        for (EvidenceEntry e : snapshot.evidenceConfigs()) {
            if (e.id() == null || e.id().isBlank()) throw new IllegalArgumentException("Evidence config without id in graph snapshot");
            if (evidence.putIfAbsent(e.id(), e) != null) throw new IllegalArgumentException("Duplicate evidence config id " + e.id());
        }
    }

    public static SnapshotGraphReader load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) throw new IOException("Graph snapshot not found: " + file);
        GraphSnapshot snapshot = MapperUtil.forFile(file.toString()).readValue(file.toFile(), GraphSnapshot.class);
        return new SnapshotGraphReader(snapshot);
    }

    @Override
    public List<String> linkedControls(String controlConfigId) {
        ControlConfig c = controls.get(controlConfigId);
        return c == null ? List.of() : c.linkedControlIds();
    }

    @Override
    public List<EvidenceConfig> evidenceConfigs(String controlConfigId) {
        ControlConfig c = controls.get(controlConfigId);
        if (c == null) return List.of();
        List<EvidenceConfig> out = new ArrayList<>();
        for (String id : c.evidenceConfigIds()) {
            EvidenceEntry e = evidence.get(id);
            String name = (e == null || e.name() == null || e.name().isBlank()) ? id : e.name();
            out.add(new EvidenceConfig(id, name));
        }
        return out;
    }

    @Override
    public Optional<EvidenceSchema> schemaFor(String evidenceConfigId) throws GraphReadException {
        EvidenceEntry e = evidence.get(evidenceConfigId);
        if (e == null || e.fields() == null) return Optional.empty();
        if (e.fields().isEmpty()) throw new GraphReadException("Evidence config " + evidenceConfigId + " declares an empty schema");
        return Optional.of(new EvidenceSchema(evidenceConfigId, e.fields()));
    }
}
