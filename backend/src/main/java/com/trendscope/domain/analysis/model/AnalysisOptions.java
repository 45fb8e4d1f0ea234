package com.trendscope.domain.analysis.model;

/**
 * Per-call switches for post analysis.
 *
 * @param noFilter skip the noise filter and return canonicalized tokens as-is
 */
public record AnalysisOptions(boolean noFilter) {

    public static final AnalysisOptions DEFAULT = new AnalysisOptions(false);

    public static final AnalysisOptions UNFILTERED = new AnalysisOptions(true);

    public static AnalysisOptions of(Boolean noFilter) {
        return Boolean.TRUE.equals(noFilter) ? UNFILTERED : DEFAULT;
    }
}
