package com.paperharvest.backend.translation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of looking a term up for one article: either this article introduces the term
 * (render it bilingually) or it was already introduced elsewhere (render it in English only)
 */
@Getter
@ToString
@AllArgsConstructor
public class TermClaim {
    private final String term;
    private final String normalizedTerm;
    private final boolean firstOccurrence;
}
