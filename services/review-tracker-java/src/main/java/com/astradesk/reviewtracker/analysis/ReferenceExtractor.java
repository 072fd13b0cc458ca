package com.astradesk.reviewtracker.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls Testim references (run URLs, {@code testim: <id>} mentions and
 * {@code test-id: ...} style fields) out of free text.
 *
 * <p>Matching is purely syntactic; nothing is checked against Testim itself.</p>
 */
public class ReferenceExtractor {

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("https?://[^\\s]*testim[^\\s]*", Pattern.CASE_INSENSITIVE),
        Pattern.compile("testim[:\\s]+[\\w\\-]+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("test(?:im)?[\\s\\-_]*(?:id|name|link|url|ref)[\\s:]+[\\w\\-/]+", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Scans {@code primary} first, then each of {@code secondaries} in order.
     * Duplicates are dropped, keeping the first occurrence.
     */
    public List<String> extract(String primary, List<String> secondaries) {
        List<String> texts = new ArrayList<>();
        texts.add(primary);
        if (secondaries != null) {
            texts.addAll(secondaries);
        }

        Set<String> references = new LinkedHashSet<>();
        for (String text : texts) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            for (Pattern pattern : PATTERNS) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    references.add(matcher.group());
                }
            }
        }
        return List.copyOf(references);
    }
}
