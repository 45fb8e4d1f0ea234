package com.trendscope.domain.analysis.model;

import java.util.Map;

/**
 * Term frequency tables of a batch of posts, split by detected language.
 * Each post contributes at most one count per term.
 */
public record TermFrequencies(
        int englishPosts,
        int chinesePosts,
        Map<String, Integer> englishFreq,
        Map<String, Integer> chineseFreq
) {}
