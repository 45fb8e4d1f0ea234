package com.trendscope.infrastructure.text.pipeline;

import com.trendscope.domain.analysis.model.AnalysisOptions;
import com.trendscope.domain.analysis.model.AnalysisResult;
import com.trendscope.domain.analysis.model.Segment;
import com.trendscope.domain.analysis.service.WordSegmenter;
import com.trendscope.infrastructure.text.canonical.TokenCanonicalizer;
import com.trendscope.infrastructure.text.classification.LanguageClassifier;
import com.trendscope.infrastructure.text.filter.NoiseFilter;
import com.trendscope.infrastructure.text.matching.TokenRecognizer;
import com.trendscope.infrastructure.text.preprocessing.PostNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Orchestrates post analysis:
 * <p>
 * normalize → segment → recognize tokens → classify language → canonicalize → filter
 * </p>
 * Language is decided on the recognized tokens, before aliasing and filtering.
 * Every stage is stateless after startup, so one instance serves concurrent callers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisPipeline {

    private final PostNormalizer normalizer;
    private final WordSegmenter segmenter;
    private final TokenRecognizer tokenRecognizer;
    private final LanguageClassifier languageClassifier;
    private final TokenCanonicalizer canonicalizer;
    private final NoiseFilter noiseFilter;

    public AnalysisResult analyse(String raw) {
        return analyse(raw, AnalysisOptions.DEFAULT);
    }

    public AnalysisResult analyse(String raw, AnalysisOptions options) {
        String normalized = normalizer.normalize(raw);
        List<Segment> segments = segmenter.segment(normalized);
        List<String> tokens = tokenRecognizer.tokenize(segments);

        boolean chinese = languageClassifier.isChinese(tokens);
        List<String> words = canonicalizer.canonicalize(tokens);
        if (!options.noFilter()) {
            words = noiseFilter.filter(words);
        }

        log.debug("Analysed post - segments: {}, tokens: {}, words: {}, chinese: {}",
                segments.size(), tokens.size(), words.size(), chinese);
        return new AnalysisResult(chinese, words);
    }
}
