package com.acme.grc.hierarchy;

import com.acme.grc.config.GrcSettings.CategoryRule;
import com.acme.grc.extract.Phrases;
import com.acme.grc.model.Requirement;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks a reusable category for an assessment by counting category keywords across its requirements.
 * Ties go to the earlier category in the configured table.
 */
public final class CategoryClassifier {

    private record Rule(String name, Pattern pattern) {}

    private final List<Rule> rules = new ArrayList<>();
    private final String fallback;

    public CategoryClassifier(List<CategoryRule> categories, String fallback) {
        for (CategoryRule c : categories) {
            if (c.name == null || c.name.isBlank() || c.keywords.isEmpty()) continue;
            rules.add(new Rule(c.name.strip(), Phrases.wordPattern(c.keywords)));
        }
        this.fallback = fallback;
    }

    public String classify(List<Requirement> requirements, String assessmentName) {
        String best = null;
        int bestScore = 0;
        for (Rule r : rules) {
            int score = 0;
            for (Requirement req : requirements) {
                Matcher m = r.pattern().matcher(req.statement());
                while (m.find()) score++;
            }
            if (score > bestScore) { best = r.name(); bestScore = score; }
        }
        if (best == null || best.equalsIgnoreCase(assessmentName == null ? "" : assessmentName.strip())) return fallback;
        return best;
    }
}
