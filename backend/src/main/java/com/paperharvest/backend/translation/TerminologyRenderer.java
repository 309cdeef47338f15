package com.paperharvest.backend.translation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Normalizes term annotations in a translated abstract so the glossary decision holds regardless
 * of what the model produced: a term introduced by the article keeps only its first
 * {@code English（中文）} annotation, every other term loses its annotations.
 */
@Component
public class TerminologyRenderer {

    private static final String OPEN = "（";
    private static final String CLOSE = "）";

    @Getter
    @AllArgsConstructor
    public static class RenderedText {
        private final String text;
        // normalized term -> Chinese rendering found at its first annotation
        private final Map<String, String> renderings;
    }

    public RenderedText render(String translated, List<TermClaim> claims) {
        String text = translated;
        Map<String, String> renderings = new LinkedHashMap<>();
        for (TermClaim claim : claims) {
            Matcher m = annotationPattern(claim.getTerm()).matcher(text);
            StringBuilder out = new StringBuilder();
            boolean first = claim.isFirstOccurrence();
            while (m.find()) {
                String replacement = m.group(1);
                if (first) {
                    String zh = m.group(2).trim();
                    renderings.put(claim.getNormalizedTerm(), zh);
                    replacement = m.group(1) + OPEN + zh + CLOSE;
                    first = false;
                }
                m.appendReplacement(out, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(out);
            text = out.toString();
        }
        return new RenderedText(text.trim(), renderings);
    }

    /**
     * Remove the Chinese annotations of {@code terms}
     */
    public String strip(String text, Collection<String> terms) {
        List<TermClaim> claims = terms.stream()
                .map(t -> new TermClaim(t, Glossary.normalize(t), false))
                .collect(Collectors.toList());
        return render(text, claims).getText();
    }

    /**
     * The term (any casing, flexible spacing) followed by a bracketed annotation containing Chinese.
     * Group 1 is the term as written, group 2 the annotation. Chinese text may touch the term directly.
     */
    static Pattern annotationPattern(String term) {
        String words = Pattern.compile("\\s+").splitAsStream(term.trim())
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile("(?<![A-Za-z0-9])(" + words + ")\\s*[（(]([^（）()]*\\p{IsHan}[^（）()]*)[）)]",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
