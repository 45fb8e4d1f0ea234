package com.trendscope.infrastructure.text.classification;

import com.trendscope.infrastructure.config.AnalysisProperties;
import com.trendscope.infrastructure.text.CharacterClasses;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Labels a post Chinese when the number of tokens containing an ideograph
 * strictly exceeds {@code floor(tokenCount * hanziPercentage)}.
 */
@Component
public class LanguageClassifier {

    private final double hanziPercentage;

    public LanguageClassifier(AnalysisProperties properties) {
        this.hanziPercentage = properties.hanziPercentage();
    }

    public boolean isChinese(List<String> tokens) {
        long hanziTokens = tokens.stream().filter(CharacterClasses::containsHanzi).count();
        return hanziTokens > Math.floor(tokens.size() * hanziPercentage);
    }
}
