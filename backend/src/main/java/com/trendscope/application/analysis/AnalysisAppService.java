package com.trendscope.application.analysis;

import com.trendscope.domain.analysis.model.AnalysisOptions;
import com.trendscope.domain.analysis.model.AnalysisResult;
import com.trendscope.domain.analysis.model.TermFrequencies;
import com.trendscope.infrastructure.text.pipeline.AnalysisPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisAppService {

    private final AnalysisPipeline analysisPipeline;

    public AnalysisResult analyse(String text, boolean noFilter) {
        return analysisPipeline.analyse(text, AnalysisOptions.of(noFilter));
    }

    /**
     * Analyse a batch of posts and count, per detected language, how many posts mention each word.
     * Blank posts are skipped. Tables keep the order in which words were first seen.
     */
    public TermFrequencies frequencies(List<String> posts, boolean noFilter) {
        AnalysisOptions options = AnalysisOptions.of(noFilter);
        Map<String, Integer> englishFreq = new LinkedHashMap<>();
        Map<String, Integer> chineseFreq = new LinkedHashMap<>();
        int englishPosts = 0;
        int chinesePosts = 0;

        for (String post : posts) {
            if (post == null || post.isBlank()) {
                continue;
            }
            AnalysisResult result = analysisPipeline.analyse(post, options);
            if (result.chinese()) {
                chinesePosts++;
                count(chineseFreq, result.words());
            } else {
                englishPosts++;
                count(englishFreq, result.words());
            }
        }

        log.info("Frequency run - posts: {}, english: {}, chinese: {}, distinct words: {}/{}",
                posts.size(), englishPosts, chinesePosts, englishFreq.size(), chineseFreq.size());
        return new TermFrequencies(englishPosts, chinesePosts, englishFreq, chineseFreq);
    }

    private static void count(Map<String, Integer> table, List<String> words) {
        for (String word : words) {
            table.merge(word, 1, Integer::sum);
        }
    }
}
