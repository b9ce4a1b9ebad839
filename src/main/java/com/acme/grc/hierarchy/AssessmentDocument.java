package com.acme.grc.hierarchy;

import com.acme.grc.model.Control;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Persisted form of an assessment:
 * <pre>
 * apiVersion: assessment.policycow.live/v1alpha1
 * kind: assessment
 * metadata: {name, description, categoryName}
 * spec:
 *   planControls: [...]
 * </pre>
 */
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec"})
public record AssessmentDocument(String apiVersion, String kind, Metadata metadata, Spec spec) {

    public static final String API_VERSION = "assessment.policycow.live/v1alpha1";
    public static final String KIND = "assessment";

    @JsonPropertyOrder({"name", "description", "categoryName"})
    public record Metadata(String name, String description, String categoryName) {}

    public record Spec(List<Control> planControls) {}
}
