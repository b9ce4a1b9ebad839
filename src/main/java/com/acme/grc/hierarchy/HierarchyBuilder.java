package com.acme.grc.hierarchy;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.config.SettingsLoader;
import com.acme.grc.extract.Phrases;
import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.model.Requirement;
import com.acme.grc.model.ThemeHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Assembles extracted requirements into an assessment tree.
 *
 * <p>Grouping rules, applied in document order:</p>
 * <ul>
 *   <li>a requirement matching a theme hint joins the first matching hint, in hint order;</li>
 *   <li>otherwise requirements split from one sentence share a synthesised parent;</li>
 *   <li>a lone, unsplit requirement becomes a top-level leaf.</li>
 * </ul>
 * A group sits at the position of its first member.
 */
public final class HierarchyBuilder {
    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final ControlNamer namer;
    private final CategoryClassifier classifier;

    public HierarchyBuilder(GrcSettings settings) {
        this.namer = new ControlNamer(settings.normativeKeywords, settings.nominalizations);
        this.classifier = new CategoryClassifier(settings.categories, settings.fallbackCategory);
    }

    public HierarchyBuilder() {
        this(SettingsLoader.defaults());
    }

    private static final class Group {
        final String theme;
        final List<Requirement> members = new ArrayList<>();
        Group(String theme) { this.theme = theme; }
    }

    public Assessment build(String name, String description, String categoryOverride,
                            List<Requirement> requirements, List<ThemeHint> hints) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Assessment name is required");
        if (requirements == null || requirements.isEmpty()) throw new IllegalArgumentException("No requirements to build from");

        List<ThemeHint> themeHints = hints == null ? List.of() : hints;
        List<Pattern> hintPatterns = new ArrayList<>();
        for (ThemeHint h : themeHints) hintPatterns.add(h.keywords().isEmpty() ? null : Phrases.wordPattern(h.keywords()));

        List<Group> groups = new ArrayList<>();
        Map<String, Group> byTheme = new HashMap<>();
        Map<Integer, Group> bySentence = new HashMap<>();
        for (Requirement r : requirements) {
            int hint = firstMatchingHint(r, hintPatterns);
            Group g;
            if (hint >= 0) {
                String theme = themeHints.get(hint).theme();
                g = byTheme.computeIfAbsent(theme, Group::new);
            } else {
                g = bySentence.computeIfAbsent(r.groupKey(), k -> new Group(null));
            }
            if (g.members.isEmpty()) groups.add(g);
            g.members.add(r);
        }

        List<Control> roots = new ArrayList<>();
        for (Group g : groups) roots.add(toControl(g));

        String category = (categoryOverride != null && !categoryOverride.isBlank())
                ? categoryOverride.strip()
                : classifier.classify(requirements, name);

        String desc = (description == null || description.isBlank())
                ? "Controls compiled from " + requirements.size() + " requirement(s) of " + name.strip() + "."
                : description.strip();

        Assessment a = new Assessment(name.strip(), desc, category, AliasAssigner.assign(roots));
        AssessmentValidator.validate(a);
        log.info("Built assessment '{}' [{}]: {} root control(s), {} control(s) total",
                a.name(), a.categoryName(), a.planControls().size(), a.flatten().size());
        return a;
    }

    private Control toControl(Group g) {
        if (g.theme != null) {
            List<Control> leaves = new ArrayList<>();
            for (Requirement r : g.members) leaves.add(leafFor(r));
            return Control.group(g.theme, "Requirements grouped under the theme '" + g.theme + "'.", leaves);
        }
        if (g.members.size() == 1) {
            Requirement r = g.members.get(0);
            return Control.leaf(namer.groupName(r.statement()), r.statement());
        }
        Requirement first = g.members.get(0);
        List<Control> leaves = new ArrayList<>();
        for (Requirement r : g.members) leaves.add(leafFor(r));
        return Control.group(namer.groupName(first.statement()), first.sentence(), leaves);
    }

    private Control leafFor(Requirement r) {
        String name = r.isSplit() ? namer.leafName(r.item()) : namer.groupName(r.statement());
        return Control.leaf(name, r.statement());
    }

    private static int firstMatchingHint(Requirement r, List<Pattern> patterns) {
        for (int i = 0; i < patterns.size(); i++) {
            Pattern p = patterns.get(i);
            if (p != null && p.matcher(r.statement()).find()) return i;
        }
        return -1;
    }

    /**
     * Reorders the children of {@code parentAlias} (root controls when null or blank) and reassigns every
     * alias in the tree.
     *
     * @param newOrder the current aliases of the sibling group, in their new order
     */
    public static Assessment reorder(Assessment a, String parentAlias, List<String> newOrder) {
        boolean root = parentAlias == null || parentAlias.isBlank();
        List<Control> rebuilt = root
                ? permute(a.planControls(), newOrder, "<root>")
                : mapNode(a.planControls(), parentAlias, c -> c.withAlias(c.alias(), c.displayable(),
                        permute(c.planControls(), newOrder, parentAlias)));
        Assessment out = a.withControls(AliasAssigner.assign(rebuilt));
        AssessmentValidator.validate(out);
        log.info("Reordered children of {} in '{}'", root ? "<root>" : parentAlias, a.name());
        return out;
    }

    /**
     * Gives control {@code alias} a custom display label. Colliding with a sibling's label is rejected.
     */
    public static Assessment relabel(Assessment a, String alias, String displayable) {
        if (displayable == null || displayable.isBlank()) throw new IllegalArgumentException("displayable must not be blank");
        Assessment out = a.withControls(mapNode(a.planControls(), alias, c -> c.withDisplayable(displayable.strip())));
        return AssessmentValidator.validate(out);
    }

    private static List<Control> permute(List<Control> siblings, List<String> newOrder, String parentLabel) {
        Map<String, Control> byAlias = new LinkedHashMap<>();
        for (Control c : siblings) byAlias.put(c.alias(), c);
        if (newOrder == null || newOrder.size() != siblings.size() || !byAlias.keySet().containsAll(newOrder)
                || new HashSet<>(newOrder).size() != newOrder.size()) {
            throw new IllegalArgumentException("New order " + newOrder + " is not a permutation of the children of "
                    + parentLabel + " " + byAlias.keySet());
        }
        List<Control> out = new ArrayList<>();
        for (String alias : newOrder) out.add(byAlias.get(alias));
        return out;
    }

    private static List<Control> mapNode(List<Control> controls, String alias,
                                         UnaryOperator<Control> fn) {
        List<Control> out = new ArrayList<>();
        boolean found = false;
        for (Control c : controls) {
            if (alias.equals(c.alias())) {
                out.add(fn.apply(c));
                found = true;
            } else if (alias.startsWith(c.alias() + ".")) {
                out.add(c.withAlias(c.alias(), c.displayable(), mapNode(c.planControls(), alias, fn)));
                found = true;
            } else {
                out.add(c);
            }
        }
        if (!found) throw new NoSuchElementException("No control with alias " + alias);
        return out;
    }
}
