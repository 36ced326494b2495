package com.vcc.copilot.service;

import com.vcc.copilot.model.ContextDocument;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical scoring: base weight, +0.3 when the whole query appears in the text,
 * +0.1 per distinct query term (longer than 2 characters) that appears, capped at 1.0.
 * Ties go to the most recent document.
 */
@Component
public class KeywordRelevanceRanker implements RelevanceRanker {

    static final double PHRASE_BOOST = 0.3;
    static final double TERM_BOOST = 0.1;
    static final double MAX_SCORE = 1.0;
    private static final int MIN_TERM_LENGTH = 3;

    private static final Comparator<ContextDocument> ORDER = Comparator
            .comparingDouble(ContextDocument::score).reversed()
            .thenComparing(ContextDocument::timestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(ContextDocument::kind)
            .thenComparing(doc -> doc.id() != null ? doc.id().toString() : "");

    @Override
    public List<ContextDocument> rank(String query, List<ContextDocument> candidates) {
        String normalizedQuery = query != null ? query.trim().toLowerCase(Locale.ROOT) : "";
        Set<String> terms = terms(normalizedQuery);

        List<ContextDocument> scored = new ArrayList<>(candidates.size());
        for (ContextDocument candidate : candidates) {
            scored.add(candidate.withScore(score(candidate, normalizedQuery, terms)));
        }
        scored.sort(ORDER);
        return scored;
    }

    double score(ContextDocument document, String normalizedQuery, Set<String> terms) {
        String text = document.text() != null ? document.text().toLowerCase(Locale.ROOT) : "";
        double score = document.baseWeight();

        if (!normalizedQuery.isEmpty() && text.contains(normalizedQuery)) {
            score += PHRASE_BOOST;
        }
        for (String term : terms) {
            if (text.contains(term)) {
                score += TERM_BOOST;
            }
        }
        // Round away floating point drift so equal boosts compare equal
        return Math.min(MAX_SCORE, Math.round(score * 1000.0) / 1000.0);
    }

    static Set<String> terms(String normalizedQuery) {
        Set<String> terms = new LinkedHashSet<>();
        for (String term : normalizedQuery.split("\\s+")) {
            if (term.length() >= MIN_TERM_LENGTH) {
                terms.add(term);
            }
        }
        return terms;
    }
}
