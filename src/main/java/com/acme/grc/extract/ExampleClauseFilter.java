package com.acme.grc.extract;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes illustrative example clauses. A sentence that opens with an example marker is dropped whole and a
 * parenthesised example is cut up to its closing bracket.
 *
 * <p>Any other example clause is cut up to where the obligation resumes: the modal, when the example sits in the
 * subject ({@code "Systems, such as X, must ..."}); otherwise a closing comma or an {@code and}/{@code or} that
 * joins a further modal. With none of those the rest of the sentence goes.</p>
 */
final class ExampleClauseFilter {

    record Filtered(String text, boolean removed, boolean dropped) {}

    private static final String CLAUSE_LEAD = " ,;:-–—(";

    private final Pattern marker;
    private final Pattern leading;
    private final Pattern parenthetical;
    private final Pattern modal;
    private final Pattern modalJoin;

    ExampleClauseFilter(List<String> markers, List<String> normativeKeywords) {
        String alt = Phrases.alternation(markers);
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        this.marker = Pattern.compile(alt, flags);
        this.leading = Pattern.compile("^[\\W_]*" + alt, flags);
        this.parenthetical = Pattern.compile("[(\\[]\\s*" + alt + "[^)\\]]*[)\\]]", flags);
        String modalAlt = Phrases.alternation(normativeKeywords);
        this.modal = Pattern.compile(modalAlt, Pattern.CASE_INSENSITIVE);
        this.modalJoin = Pattern.compile(",?\\s+(?:and|or)\\s+(?=" + modalAlt + ")", Pattern.CASE_INSENSITIVE);
    }

    Filtered apply(String sentence) {
        String s = Phrases.collapse(sentence);
        if (leading.matcher(s).lookingAt()) return new Filtered("", true, true);

        boolean removed = false;
        Matcher p = parenthetical.matcher(s);
        if (p.find()) {
            s = Phrases.collapse(p.replaceAll(" "));
            removed = true;
        }

        Matcher m = marker.matcher(s);
        while (m.find()) {
            s = cutClause(s, m.start(), m.end());
            removed = true;
            m = marker.matcher(s);
        }

        s = Phrases.collapse(s).replaceAll("\\s+([,;:.])", "$1");
        if (s.isEmpty()) return new Filtered("", true, true);
        return new Filtered(s, removed, false);
    }

    private String cutClause(String s, int start, int end) {
        int lead = start;
        while (lead > 0 && CLAUSE_LEAD.indexOf(s.charAt(lead - 1)) >= 0) lead--;
        String head = s.substring(0, lead);

        int resume = -1;
        if (!modal.matcher(head).find()) {
            Matcher next = modal.matcher(s).useTransparentBounds(true).region(end, s.length());
            if (next.find()) resume = next.start();
        } else {
            Matcher join = modalJoin.matcher(s).useTransparentBounds(true).region(end, s.length());
            if (join.find()) resume = join.start();
            if (s.substring(lead, start).indexOf(',') >= 0) {
                int comma = s.indexOf(',', end);
                if (comma >= 0 && (resume < 0 || comma < resume)) resume = comma + 1;
            }
        }
        if (resume < 0) return head;
        return head + " " + s.substring(resume).strip();
    }

    boolean containsMarker(String text) {
        return marker.matcher(text).find();
    }
}
