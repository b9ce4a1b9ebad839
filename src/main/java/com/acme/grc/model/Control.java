package com.acme.grc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A node of the assessment tree. {@code isLeaf} always mirrors whether {@code planControls} is empty.
 */
@JsonPropertyOrder({"alias", "displayable", "name", "description", "isLeaf", "planControls"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Control(
        @JsonProperty("alias") String alias,
        @JsonProperty("displayable") String displayable,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("isLeaf") boolean isLeaf,
        @JsonProperty("planControls") List<Control> planControls
) {
    public Control {
        planControls = planControls == null ? List.of() : List.copyOf(planControls);
        isLeaf = planControls.isEmpty();
    }

    public static Control leaf(String name, String description) {
        return new Control(null, null, name, description, true, List.of());
    }

    public static Control group(String name, String description, List<Control> children) {
        return new Control(null, null, name, description, false, children);
    }

    public Control withAlias(String newAlias, String newDisplayable, List<Control> children) {
        return new Control(newAlias, newDisplayable, name, description, children.isEmpty(), children);
    }

    public Control withDisplayable(String label) {
        return new Control(alias, label, name, description, isLeaf, planControls);
    }
}
