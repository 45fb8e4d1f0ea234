package com.trendscope.domain.analysis.service;

import com.trendscope.domain.analysis.model.Segment;

import java.util.List;

/**
 * Locale-aware word segmentation. Concatenating the texts of the returned
 * segments reproduces the input.
 */
public interface WordSegmenter {

    List<Segment> segment(String text);
}
