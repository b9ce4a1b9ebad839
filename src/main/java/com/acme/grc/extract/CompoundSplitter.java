package com.acme.grc.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a normative sentence carrying several obligations into self-contained statements.
 *
 * <p>Two shapes are recognised: repeated modals ({@code "X must A and must B"}) and a trailing coordinated
 * object list after a preposition ({@code "X must A for all B and C"}). The subject and the shared prefix are
 * repeated in every statement so none depends on its siblings.</p>
 *
 * <p>A later modal clause may refer back with {@code it} or {@code them}; the pronoun is replaced by the object
 * of the clause before it. Any other back-reference, or an object that cannot be isolated, leaves the sentence
 * whole.</p>
 */
final class CompoundSplitter {

    record Clause(String statement, String item) {}

    static final int MAX_ITEM_WORDS = 6;

    private static final Pattern PREPOSITION = Pattern.compile(
            "(?<![\\w])(?:for|to|on|of|across|within|from|by)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern COORDINATOR = Pattern.compile(
            "(?<![\\w])(?:and|or|and/or)(?![\\w])", Pattern.CASE_INSENSITIVE);
    private static final Pattern ITEM_SEPARATOR = Pattern.compile(
            "\\s*,\\s*(?:and|or|and/or)\\s+|\\s*,\\s*|\\s+(?:and/or|and|or)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern OBJECT_PRONOUN = Pattern.compile("(?<![\\w])(?:it|them)(?![\\w])");
    private static final Pattern OTHER_PRONOUN = Pattern.compile(
            "(?<![\\w])(?:they|this|these|those|its|their)(?![\\w])");
    private static final Set<String> OBJECT_STOP = Set.of(
            "for", "to", "on", "of", "across", "within", "from", "by", "at", "in", "with", "without", "per", "via",
            "before", "after", "during", "until", "unless", "when", "if", "every", "each", "using", "through");

    private final Pattern modal;
    private final Pattern modalJoin;
    private final Set<String> quantifiers;

    CompoundSplitter(List<String> normativeKeywords, List<String> quantifiers) {
        String alt = Phrases.alternation(normativeKeywords);
        this.modal = Pattern.compile(alt, Pattern.CASE_INSENSITIVE);
        this.modalJoin = Pattern.compile(",?\\s+(?:and|or)\\s+(?=" + alt + ")", Pattern.CASE_INSENSITIVE);
        this.quantifiers = quantifiers.stream().map(q -> q.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    List<Clause> split(String sentence) {
        List<Clause> out = new ArrayList<>();
        for (String clause : splitOnModal(sentence)) out.addAll(splitObjectList(clause));
        return out;
    }

    List<String> splitOnModal(String sentence) {
        String s = Phrases.stripTerminal(sentence);
        Matcher first = modal.matcher(s);
        if (!first.find()) return List.of(Phrases.asSentence(s));

        String subject = s.substring(0, first.start()).strip();
        List<String> parts = new ArrayList<>();
        Matcher join = modalJoin.matcher(s);
        join.region(first.end(), s.length());
        int prev = first.start();
        while (join.find()) {
            parts.add(s.substring(prev, join.start()));
            prev = join.end();
        }
        parts.add(s.substring(prev));
        if (parts.size() == 1) return List.of(Phrases.asSentence(s));

        for (int i = 1; i < parts.size(); i++) {
            String part = parts.get(i);
            if (OTHER_PRONOUN.matcher(part).find()) return List.of(Phrases.asSentence(s));
            if (!OBJECT_PRONOUN.matcher(part).find()) continue;
            String object = objectOf(parts.get(i - 1));
            if (object == null) return List.of(Phrases.asSentence(s));
            parts.set(i, OBJECT_PRONOUN.matcher(part).replaceAll(Matcher.quoteReplacement(object)));
        }

        List<String> out = new ArrayList<>();
        for (String p : parts) {
            String clause = subject.isEmpty() ? p.strip() : subject + " " + p.strip();
            out.add(Phrases.asSentence(clause));
        }
        return out;
    }

    /** The direct object of a modal clause ({@code "must approve access requests daily"} gives "access requests"). */
    private String objectOf(String part) {
        Matcher m = modal.matcher(part.strip());
        if (!m.lookingAt()) return null;
        String[] words = part.strip().substring(m.end()).strip().split("\\s+");
        int i = 0;
        if (i < words.length && words[i].equalsIgnoreCase("not")) i++;
        if (i >= words.length || words[i].equalsIgnoreCase("be")) return null;

        List<String> object = new ArrayList<>();
        for (i++; i < words.length; i++) {
            String w = words[i];
            String bare = w.replaceAll("[,;:]+$", "");
            String lower = bare.toLowerCase(Locale.ROOT);
            if (OBJECT_STOP.contains(lower) || (lower.length() > 4 && lower.endsWith("ly"))) break;
            if (OBJECT_PRONOUN.matcher(bare).matches() || OTHER_PRONOUN.matcher(bare).matches()) return null;
            object.add(bare);
            if (!bare.equals(w)) break;
        }
        if (object.isEmpty() || object.size() > MAX_ITEM_WORDS) return null;
        return String.join(" ", object);
    }

    List<Clause> splitObjectList(String clause) {
        String body = Phrases.stripTerminal(clause);
        Matcher m = modal.matcher(body);
        if (!m.find()) return List.of(new Clause(Phrases.asSentence(body), null));

        Matcher prep = PREPOSITION.matcher(body);
        prep.region(m.end(), body.length());
        int prefixEnd = -1;
        while (prep.find()) prefixEnd = prep.end();
        if (prefixEnd < 0) return List.of(new Clause(Phrases.asSentence(body), null));

        String tail = body.substring(prefixEnd).strip();
        if (!COORDINATOR.matcher(tail).find()) return List.of(new Clause(Phrases.asSentence(body), null));

        String quantifier = null;
        int space = tail.indexOf(' ');
        if (space > 0 && quantifiers.contains(tail.substring(0, space).toLowerCase(Locale.ROOT))) {
            quantifier = tail.substring(0, space);
            tail = tail.substring(space + 1).strip();
        }

        List<String> items = new ArrayList<>();
        for (String item : ITEM_SEPARATOR.split(tail)) {
            String t = item.strip();
            if (t.isEmpty()) continue;
            if (Phrases.wordCount(t) > MAX_ITEM_WORDS) return List.of(new Clause(Phrases.asSentence(body), null));
            items.add(t);
        }
        if (items.size() < 2) return List.of(new Clause(Phrases.asSentence(body), null));

        String prefix = body.substring(0, prefixEnd);
        List<Clause> out = new ArrayList<>();
        for (String item : items) {
            String object = quantifier == null ? item : quantifier + " " + item;
            out.add(new Clause(Phrases.asSentence(prefix + object), item));
        }
        return out;
    }
}
