package com.acme.grc.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for extraction, categorisation, traversal and sampling. Defaults live in {@code grc-defaults.yaml};
 * a user file may override any subset of keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GrcSettings {

    public List<String> exampleMarkers = new ArrayList<>();
    public List<String> normativeKeywords = new ArrayList<>();
    public List<String> quantifiers = new ArrayList<>();
    public Map<String, String> nominalizations = new LinkedHashMap<>();
    public List<CategoryRule> categories = new ArrayList<>();
    public String fallbackCategory = "General Governance";

    @JsonMerge
    public Traversal traversal = new Traversal();

    @JsonMerge
    public Samples samples = new Samples();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CategoryRule {
        public String name;
        public List<String> keywords = new ArrayList<>();

        public CategoryRule() {}

        public CategoryRule(String name, List<String> keywords) {
            this.name = name;
            this.keywords = new ArrayList<>(keywords);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Traversal {
        public int maxDepth = 25;
        public int maxNodes = 500;
        public int parallelism = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Samples {
        public int defaultRows = 3;
        public int maxRows = 10;
    }
}
