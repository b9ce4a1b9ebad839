package com.acme.grc.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Breaks a document into sentence candidates. List items and short headings become segments of their own;
 * common abbreviations never terminate a sentence.
 */
final class SentenceSplitter {

    private static final Pattern BULLET = Pattern.compile(
            "^(?:[-*•▪]|\\(?\\d+(?:\\.\\d+)*[.)]|\\d+(?:\\.\\d+)+|\\(?[a-zA-Z][.)])\\s+(.*)$");
    private static final Pattern SENTENCE_END = Pattern.compile(
            "(?<!\\b(?:e\\.g|i\\.e|etc|vs|eg))[.!?;]+(?=\\s|$)", Pattern.CASE_INSENSITIVE);
    private static final int HEADING_MAX_WORDS = 8;

    private final Pattern normative;

    SentenceSplitter(Pattern normative) {
        this.normative = normative;
    }

    List<String> split(String text) {
        List<String> segments = new ArrayList<>();
        StringBuilder para = new StringBuilder();
        for (String line : text.split("\\R")) {
            String t = line.strip();
            if (t.isEmpty()) { flush(para, segments); continue; }

            Matcher bullet = BULLET.matcher(t);
            if (bullet.matches()) {
                flush(para, segments);
                para.append(bullet.group(1).strip());
                continue;
            }
            if (isHeading(t, para)) {
                flush(para, segments);
                segments.add(t);
                continue;
            }
            if (para.length() > 0) para.append(' ');
            para.append(t);
        }
        flush(para, segments);

        List<String> sentences = new ArrayList<>();
        for (String seg : segments) {
            int prev = 0;
            Matcher m = SENTENCE_END.matcher(seg);
            while (m.find()) {
                add(sentences, seg.substring(prev, m.start()));
                prev = m.end();
            }
            add(sentences, seg.substring(prev));
        }
        return sentences;
    }

    private boolean isHeading(String line, StringBuilder para) {
        if (Phrases.wordCount(line) > HEADING_MAX_WORDS) return false;
        char first = line.charAt(0);
        if (!Character.isUpperCase(first) && !Character.isDigit(first)) return false;
        char last = line.charAt(line.length() - 1);
        if (".!?;:,".indexOf(last) >= 0) return false;
        if (normative.matcher(line).find()) return false;
        if (para.length() == 0) return true;
        char paraLast = para.charAt(para.length() - 1);
        return ".!?;:".indexOf(paraLast) >= 0;
    }

    private static void flush(StringBuilder para, List<String> segments) {
        if (para.length() > 0) segments.add(para.toString());
        para.setLength(0);
    }

    private static void add(List<String> out, String s) {
        String t = Phrases.collapse(s);
        if (!t.isEmpty()) out.add(t);
    }
}
