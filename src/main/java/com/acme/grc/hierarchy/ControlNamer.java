package com.acme.grc.hierarchy;

import com.acme.grc.extract.Phrases;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives short control names from requirement statements: the object of the obligation followed by the
 * nominalised verb ("must enforce MFA for ..." becomes "MFA Enforcement").
 */
public final class ControlNamer {

    private static final Set<String> SMALL = Set.of("a", "an", "and", "as", "at", "by", "for", "from", "in", "of",
            "on", "or", "the", "to", "with");
    private static final Set<String> DETERMINERS = Set.of("the", "a", "an", "all", "each", "every", "any", "its",
            "their", "our", "this", "these", "those", "such");
    private static final Set<String> STOP = Set.of("for", "to", "on", "of", "across", "within", "from", "by", "in",
            "at", "with", "that", "and", "or", "when", "where", "before", "after", "unless", "if", "using", "via",
            "per", "under", "into", "over", "than", "every", "annually", "quarterly", "monthly", "weekly", "daily");
    private static final Set<String> ADVERBS = Set.of("also", "always", "only", "still", "then", "immediately");
    private static final Set<String> PARTICLES = Set.of("up", "out", "down", "off");
    private static final int MAX_OBJECT_WORDS = 4;

    private final Pattern modal;
    private final Map<String, String> nominalizations;

    public ControlNamer(List<String> normativeKeywords, Map<String, String> nominalizations) {
        this.modal = Phrases.wordPattern(normativeKeywords);
        this.nominalizations = nominalizations;
    }

    public String groupName(String statement) {
        String body = Phrases.stripTerminal(statement);
        Matcher m = modal.matcher(body);
        if (!m.find()) return titleCase(limit(stripDeterminers(words(body)), MAX_OBJECT_WORDS));

        List<String> subject = words(body.substring(0, m.start()));
        List<String> pred = words(body.substring(m.end()));
        int i = skipAdverbs(pred, 0);
        boolean negated = false;
        if (i < pred.size() && pred.get(i).equalsIgnoreCase("not")) { negated = true; i = skipAdverbs(pred, i + 1); }

        boolean passive = false;
        if (i < pred.size() && pred.get(i).equalsIgnoreCase("be")) { passive = true; i = skipAdverbs(pred, i + 1); }
        if (i >= pred.size()) return titleCase(limit(stripDeterminers(subject), MAX_OBJECT_WORDS));

        String verb = lower(pred.get(i));
        if (verb.equals("ensure")) {
            int j = i + 1;
            if (j < pred.size() && lower(pred.get(j)).equals("that")) j++;
            return titleCase(limit(stripDeterminers(untilStop(pred, j)), MAX_OBJECT_WORDS));
        }
        if (passive) verb = stem(verb);

        List<String> object;
        if (passive) {
            object = stripDeterminers(subject);
        } else {
            int j = i + 1;
            if (j < pred.size() && PARTICLES.contains(lower(pred.get(j)))) j++;
            object = stripDeterminers(untilStop(pred, j));
        }
        object = limit(object, MAX_OBJECT_WORDS);

        String noun = nominalize(verb);
        String name = object.isEmpty() ? noun : titleCase(object) + " " + noun;
        return negated ? "No " + name : name;
    }

    public String leafName(String item) {
        return titleCase(stripDeterminers(words(item)));
    }

    String nominalize(String verb) {
        String v = lower(verb);
        String mapped = nominalizations.get(v);
        if (mapped != null) return mapped;
        String noun;
        if (v.endsWith("ate")) noun = v.substring(0, v.length() - 1) + "ion";
        else if (v.endsWith("ize")) noun = v.substring(0, v.length() - 1) + "ation";
        else if (v.endsWith("e") && !v.endsWith("ee")) noun = v.substring(0, v.length() - 1) + "ing";
        else noun = v + "ing";
        return capitalize(noun);
    }

    String stem(String participle) {
        String w = lower(participle);
        if (nominalizations.containsKey(w)) return w;
        if (w.endsWith("ied")) return w.substring(0, w.length() - 3) + "y";
        if (w.endsWith("ed")) {
            String base = w.substring(0, w.length() - 2);
            String withE = w.substring(0, w.length() - 1);
            if (nominalizations.containsKey(base)) return base;
            if (nominalizations.containsKey(withE)) return withE;
            int n = base.length();
            if (n > 2 && base.charAt(n - 1) == base.charAt(n - 2)) return base.substring(0, n - 1);
            return base;
        }
        return w;
    }

    public static String titleCase(List<String> words) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < words.size(); i++) {
            String w = words.get(i);
            if (isAcronym(w)) out.add(w);
            else if (i > 0 && SMALL.contains(lower(w))) out.add(lower(w));
            else out.add(capitalize(lower(w)));
        }
        return String.join(" ", out);
    }

    private static boolean isAcronym(String w) {
        boolean hasUpper = false;
        for (char c : w.toCharArray()) {
            if (Character.isDigit(c)) return true;
            if (Character.isLowerCase(c)) return false;
            if (Character.isUpperCase(c)) hasUpper = true;
        }
        return hasUpper && w.length() > 1;
    }

    private static List<String> words(String s) {
        String t = Phrases.collapse(s).replaceAll("[,;:()\\[\\]\"]", " ");
        t = Phrases.collapse(t);
        return t.isEmpty() ? List.of() : Arrays.asList(t.split(" "));
    }

    private static List<String> untilStop(List<String> words, int from) {
        List<String> out = new ArrayList<>();
        for (int k = from; k < words.size(); k++) {
            if (STOP.contains(lower(words.get(k)))) break;
            out.add(words.get(k));
        }
        return out;
    }

    private static List<String> stripDeterminers(List<String> words) {
        int k = 0;
        while (k < words.size() && DETERMINERS.contains(lower(words.get(k)))) k++;
        return words.subList(k, words.size());
    }

    private static List<String> limit(List<String> words, int max) {
        return words.size() <= max ? words : words.subList(0, max);
    }

    private static int skipAdverbs(List<String> words, int from) {
        int k = from;
        while (k < words.size()) {
            String w = lower(words.get(k));
            if (!ADVERBS.contains(w) && !(w.endsWith("ly") && w.length() > 4)) break;
            k++;
        }
        return k;
    }

    private static String lower(String s) { return s.toLowerCase(Locale.ROOT); }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
