package com.paperharvest.backend.translation;

import com.paperharvest.backend.config.TranslationConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Matches a configured vocabulary (whole words, case-insensitive, longest term first) and,
 * optionally, upper-case acronyms such as {@code LLM} or {@code GAN}.
 */
@Component
public class KeywordTermSegmenter implements TermSegmenter {

    private static final Pattern ACRONYM = Pattern.compile("(?<![\\p{L}\\p{N}])[A-Z][A-Z0-9]{1,9}(?![\\p{L}\\p{N}])");

    private final List<Pattern> vocabulary;
    private final boolean detectAcronyms;

    @Autowired
    public KeywordTermSegmenter(TranslationConfig config) {
        this(config.getTerms(), config.isDetectAcronyms());
    }

    public KeywordTermSegmenter(List<String> terms, boolean detectAcronyms) {
        this.vocabulary = terms.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(KeywordTermSegmenter::termPattern)
                .collect(Collectors.toList());
        this.detectAcronyms = detectAcronyms;
    }

    @Override
    public List<String> segment(String text) {
        if (text == null || text.isBlank()) return List.of();

        // start offset -> matched span, longer vocabulary terms claim their span first
        TreeMap<Integer, int[]> spans = new TreeMap<>();
        Map<Integer, String> found = new LinkedHashMap<>();
        for (Pattern pattern : vocabulary) {
            collect(pattern.matcher(text), spans, found);
        }
        if (detectAcronyms) {
            collect(ACRONYM.matcher(text), spans, found);
        }

        Map<String, String> ordered = new LinkedHashMap<>();
        new TreeMap<>(found).values().forEach(term -> ordered.putIfAbsent(Glossary.normalize(term), term));
        return new ArrayList<>(ordered.values());
    }

    private static void collect(Matcher m, TreeMap<Integer, int[]> spans, Map<Integer, String> found) {
        while (m.find()) {
            if (overlaps(spans, m.start(), m.end())) continue;
            spans.put(m.start(), new int[]{m.start(), m.end()});
            found.put(m.start(), m.group());
        }
    }

    private static boolean overlaps(TreeMap<Integer, int[]> spans, int start, int end) {
        Map.Entry<Integer, int[]> before = spans.floorEntry(start);
        if (before != null && before.getValue()[1] > start) return true;
        Map.Entry<Integer, int[]> after = spans.ceilingEntry(start);
        return after != null && after.getKey() < end;
    }

    static Pattern termPattern(String term) {
        String words = Pattern.compile("\\s+").splitAsStream(term.trim())
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + words + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
