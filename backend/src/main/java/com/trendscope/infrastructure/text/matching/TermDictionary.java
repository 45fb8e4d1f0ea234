package com.trendscope.infrastructure.text.matching;

import com.trendscope.domain.analysis.model.Segment;
import com.trendscope.domain.analysis.service.WordSegmenter;
import com.trendscope.infrastructure.config.AnalysisConfigurationException;
import com.trendscope.infrastructure.config.AnalysisProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configured multi-word terms, pre-segmented with the same segmenter used for posts.
 * Terms are grouped by segment count; within a group configuration order is kept,
 * which makes the first configured term the winner among equal-length candidates.
 */
@Slf4j
@Component
public class TermDictionary {

    private final Map<Integer, List<List<String>>> termsBySize;

    /**
     * Segment count of the longest term, 0 when no terms are configured.
     */
    @Getter
    private final int maxTermLength;

    public TermDictionary(AnalysisProperties properties, WordSegmenter segmenter) {
        Map<Integer, List<List<String>>> grouped = new HashMap<>();
        int longest = 0;
        for (String term : properties.terms()) {
            if (term == null || term.isBlank()) {
                throw new AnalysisConfigurationException("analysis.terms contains a blank term");
            }
            List<String> parts = segmenter.segment(term.toLowerCase(Locale.ROOT)).stream()
                    .map(Segment::text)
                    .toList();
            grouped.computeIfAbsent(parts.size(), size -> new ArrayList<>()).add(parts);
            longest = Math.max(longest, parts.size());
        }
        grouped.replaceAll((size, terms) -> Collections.unmodifiableList(terms));
        this.termsBySize = Collections.unmodifiableMap(grouped);
        this.maxTermLength = longest;
        log.info("Term dictionary ready: {} terms, longest spans {} segments", properties.terms().size(), longest);
    }

    /**
     * Look up a term spelled exactly by {@code segments[start, start + size)}.
     *
     * @return the term's joined text, or empty when no term of that size matches
     */
    public Optional<String> match(List<Segment> segments, int start, int size) {
        if (start + size > segments.size()) {
            return Optional.empty();
        }
        List<List<String>> candidates = termsBySize.getOrDefault(size, List.of());
        for (List<String> term : candidates) {
            if (spells(term, segments, start)) {
                return Optional.of(String.join("", term));
            }
        }
        return Optional.empty();
    }

    private static boolean spells(List<String> term, List<Segment> segments, int start) {
        for (int offset = 0; offset < term.size(); offset++) {
            if (!term.get(offset).equals(segments.get(start + offset).text())) {
                return false;
            }
        }
        return true;
    }
}
