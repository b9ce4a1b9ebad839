package com.acme.grc.model;

/**
 * One atomic obligation extracted from policy text.
 *
 * @param rawSpan          the sentence the statement came from, before example removal
 * @param sentence         the source sentence after example removal
 * @param statement        normalized, independently verifiable statement
 * @param examplesExcluded true when an example clause was cut from the source sentence
 * @param groupKey         index of the source sentence; statements split from one sentence share it
 * @param item             the coordinated item this statement was split on, or null when not split
 */
public record Requirement(String rawSpan, String sentence, String statement, boolean examplesExcluded,
                          int groupKey, String item) {

    public boolean isSplit() { return item != null; }
}
