package com.acme.grc.extract;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text helpers shared by extraction and control naming.
 */
public final class Phrases {
    private Phrases() {}

    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern TRAILING = Pattern.compile("[\\s,;:.!?\\-–—]+$");

    /**
     * Regex alternation matching any of {@code phrases} as whole words, longest first, whitespace-tolerant.
     */
    public static String alternation(List<String> phrases) {
        return phrases.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.strip().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Phrases::phraseRegex)
                .collect(Collectors.joining("|", "(?:", ")"));
    }

    public static Pattern wordPattern(List<String> phrases) {
        return Pattern.compile(alternation(phrases), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String phraseRegex(String phrase) {
        String body = WS.splitAsStream(phrase).map(Pattern::quote).collect(Collectors.joining("\\s+"));
        boolean wordEnd = Character.isLetterOrDigit(phrase.charAt(phrase.length() - 1));
        return "(?<![\\w])" + body + (wordEnd ? "(?![\\w])" : "");
    }

    public static String collapse(String s) {
        return s == null ? "" : WS.matcher(s).replaceAll(" ").strip();
    }

    /** Collapses whitespace, drops trailing punctuation, capitalizes and terminates with a period. */
    public static String asSentence(String s) {
        String t = TRAILING.matcher(collapse(s)).replaceAll("");
        if (t.isEmpty()) return t;
        return Character.toUpperCase(t.charAt(0)) + t.substring(1) + ".";
    }

    public static String stripTerminal(String s) {
        return TRAILING.matcher(collapse(s)).replaceAll("");
    }

    public static int wordCount(String s) {
        String t = collapse(s);
        return t.isEmpty() ? 0 : WS.split(t).length;
    }
}
