package com.contentforge.domain.content.model.valobj;

import java.util.List;

/**
 * A research source with credibility metadata.
 */
public record Source(String url,
                     String title,
                     String author,
                     String publicationDate,
                     double credibilityScore,
                     List<String> keyQuotes,
                     List<String> keyFacts) {

    public Source {
        keyQuotes = keyQuotes == null ? List.of() : List.copyOf(keyQuotes);
        keyFacts = keyFacts == null ? List.of() : List.copyOf(keyFacts);
    }

    public Source(String url, String title, double credibilityScore) {
        this(url, title, null, null, credibilityScore, List.of(), List.of());
    }
}
