package com.trendscope.domain.analysis.service;

/**
 * Converts traditional Chinese characters to their simplified forms.
 * Text in other scripts passes through unchanged.
 */
public interface ChineseScriptConverter {

    String toSimplified(String text);
}
