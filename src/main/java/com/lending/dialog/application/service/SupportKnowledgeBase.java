package com.lending.dialog.application.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.lending.dialog.domain.valueobject.Language;

/**
 * Fixed bilingual FAQ answered before any remote support responder.
 * <p>
 * Entries are checked in order and the first entry with a keyword present in
 * the question as whole words wins.
 * </p>
 */
public class SupportKnowledgeBase {

    private record Entry(String answerKey, List<String> keywords) {
    }

    private static final List<Entry> ENTRIES = List.of(
            new Entry("kb_emi", List.of("pay my emi", "pay emi", "emi payment", "repay", "ईएमआई", "भुगतान")),
            new Entry("kb_status", List.of("loan status", "status of my loan", "application status", "स्थिति")),
            new Entry("kb_statement", List.of("statement", "स्टेटमेंट")),
            new Entry("kb_foreclosure", List.of("foreclose", "foreclosure", "close my loan", "prepay", "बंद")),
            new Entry("kb_interest", List.of("interest rate", "rate of interest", "roi", "apr", "ब्याज")));

    // Letters include combining marks so Devanagari words stay in one token.
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{M}\\p{N}]+");

    private final PromptCatalog catalog;

    public SupportKnowledgeBase(PromptCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        this.catalog = catalog;
    }

    /**
     * @return localized answer of the first matching entry, or empty
     */
    public Optional<String> answer(String question, Language language) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        String padded = " " + NON_WORD.matcher(question.toLowerCase(Locale.ROOT)).replaceAll(" ").trim() + " ";
        return ENTRIES.stream()
                .filter(entry -> entry.keywords().stream().anyMatch(k -> padded.contains(" " + k + " ")))
                .findFirst()
                .map(entry -> catalog.text(language, entry.answerKey()));
    }
}
