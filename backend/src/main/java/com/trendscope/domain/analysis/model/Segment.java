package com.trendscope.domain.analysis.model;

/**
 * One unit produced by word segmentation.
 *
 * @param text     the exact text of the segment
 * @param wordLike true for linguistic words (letters, numbers, ideographs),
 *                 false for whitespace and punctuation
 */
public record Segment(String text, boolean wordLike) {}
