package com.trendscope.domain.analysis.model;

import java.util.List;

/**
 * Outcome of analysing a single post.
 *
 * @param chinese true when the post is classified as Chinese by ideograph density
 * @param words   unique terms in first-seen order
 */
public record AnalysisResult(boolean chinese, List<String> words) {

    public AnalysisResult {
        words = List.copyOf(words);
    }
}
