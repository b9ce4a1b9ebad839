package com.acme.grc.extract;

import com.acme.grc.config.GrcSettings;
import com.acme.grc.config.SettingsLoader;
import com.acme.grc.extract.CompoundSplitter.Clause;
import com.acme.grc.extract.ExampleClauseFilter.Filtered;
import com.acme.grc.model.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns raw policy text into an ordered list of atomic requirements.
 *
 * <ol>
 *   <li>split the text into sentences (list items and headings are their own segments)</li>
 *   <li>drop or cut example clauses</li>
 *   <li>keep normative sentences only ("must", "shall", ...)</li>
 *   <li>split compound obligations into independent statements</li>
 * </ol>
 */
public final class RequirementExtractor {
    private static final Logger log = LoggerFactory.getLogger(RequirementExtractor.class);

    private final SentenceSplitter sentences;
    private final ExampleClauseFilter examples;
    private final CompoundSplitter splitter;
    private final Pattern normative;

    public RequirementExtractor(GrcSettings settings) {
        this.normative = Phrases.wordPattern(settings.normativeKeywords);
        this.sentences = new SentenceSplitter(normative);
        this.examples = new ExampleClauseFilter(settings.exampleMarkers, settings.normativeKeywords);
        this.splitter = new CompoundSplitter(settings.normativeKeywords, settings.quantifiers);
    }

    public RequirementExtractor() {
        this(SettingsLoader.defaults());
    }

    public List<Requirement> extract(String text) throws ExtractionEmptyException {
        if (text == null || text.isBlank()) throw new ExtractionEmptyException("Document is empty; no requirements extracted.");

        List<Requirement> out = new ArrayList<>();
        int sentenceNo = 0, exampleSentences = 0, descriptive = 0;
        for (String raw : sentences.split(text)) {
            Filtered f = examples.apply(raw);
            if (f.dropped()) { exampleSentences++; continue; }
            if (!normative.matcher(f.text()).find()) { descriptive++; continue; }

            String sentence = Phrases.asSentence(f.text());
            int key = sentenceNo++;
            for (Clause c : splitter.split(sentence)) {
                out.add(new Requirement(raw, sentence, c.statement(), f.removed(), key, c.item()));
            }
        }

        log.info("Extracted {} requirement(s) from {} normative sentence(s); skipped {} example and {} descriptive sentence(s)",
                out.size(), sentenceNo, exampleSentences, descriptive);

        if (out.isEmpty()) {
            throw new ExtractionEmptyException("No requirement statements found (" + exampleSentences
                    + " example sentence(s), " + descriptive + " descriptive sentence(s) skipped).");
        }
        return List.copyOf(out);
    }

    /** True when {@code text} still carries an example marker. */
    public boolean mentionsExample(String text) {
        return text != null && examples.containsMarker(text);
    }
}
