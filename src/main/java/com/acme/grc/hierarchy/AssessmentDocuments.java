package com.acme.grc.hierarchy;

import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.util.MapperUtil;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** YAML (de)serialization of assessments. Reading always re-validates the tree. */
public final class AssessmentDocuments {
    private AssessmentDocuments() {}

    public static AssessmentDocument toDocument(Assessment a) {
        return new AssessmentDocument(AssessmentDocument.API_VERSION, AssessmentDocument.KIND,
                new AssessmentDocument.Metadata(a.name(), a.description(), a.categoryName()),
                new AssessmentDocument.Spec(a.planControls()));
    }

    public static Assessment fromDocument(AssessmentDocument doc) {
        if (doc == null || doc.metadata() == null) throw new IllegalArgumentException("Assessment document has no metadata");
        if (doc.kind() != null && !AssessmentDocument.KIND.equalsIgnoreCase(doc.kind())) {
            throw new IllegalArgumentException("Unsupported kind '" + doc.kind() + "', expected " + AssessmentDocument.KIND);
        }
        AssessmentDocument.Metadata m = doc.metadata();
        List<Control> controls = doc.spec() == null ? List.of() : doc.spec().planControls();
        Assessment a = new Assessment(strip(m.name()), strip(m.description()), strip(m.categoryName()), controls);
        return AssessmentValidator.validate(a);
    }

    public static String toYaml(Assessment a) {
        try {
            return MapperUtil.YAML.writeValueAsString(toDocument(a));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize assessment '" + a.name() + "'", e);
        }
    }

    public static Assessment fromYaml(String yaml) throws IOException {
        if (yaml == null || yaml.isBlank()) throw new IllegalArgumentException("YAML content is empty");
        return fromDocument(MapperUtil.YAML.readValue(yaml, AssessmentDocument.class));
    }

    public static void write(Assessment a, Path out) throws IOException {
        Files.writeString(out, toYaml(a), StandardCharsets.UTF_8);
    }

    public static Assessment read(Path in) throws IOException {
        return fromYaml(Files.readString(in, StandardCharsets.UTF_8));
    }

    private static String strip(String s) { return s == null ? null : s.strip(); }
}
