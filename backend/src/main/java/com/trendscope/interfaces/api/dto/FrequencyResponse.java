package com.trendscope.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendscope.domain.analysis.model.TermFrequencies;

import java.util.Map;

public record FrequencyResponse(
        @JsonProperty("english_posts") int englishPosts,
        @JsonProperty("chinese_posts") int chinesePosts,
        @JsonProperty("english_freq") Map<String, Integer> englishFreq,
        @JsonProperty("chinese_freq") Map<String, Integer> chineseFreq
) {
    public static FrequencyResponse from(TermFrequencies frequencies) {
        return new FrequencyResponse(
                frequencies.englishPosts(),
                frequencies.chinesePosts(),
                frequencies.englishFreq(),
                frequencies.chineseFreq());
    }
}
