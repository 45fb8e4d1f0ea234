package com.trendscope.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendscope.domain.analysis.model.AnalysisResult;

import java.util.List;

public record AnalyseResponse(
        @JsonProperty("is_chinese") boolean chinese,
        List<String> words
) {
    public static AnalyseResponse from(AnalysisResult result) {
        return new AnalyseResponse(result.chinese(), result.words());
    }
}
