package com.trendscope.infrastructure.text.filter;

import com.trendscope.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops noise tokens: numbers and amounts, very short words, non-ASCII and
 * punctuation-heavy tokens, and ignore-list words. The ideograph and kana rules
 * are only part of the chain when enabled in configuration.
 */
@Slf4j
@Component
public class NoiseFilter {

    private final List<NoiseRule> rules;

    public NoiseFilter(AnalysisProperties properties, SymbolTable symbolTable, IgnoreWordSet ignoreWordSet) {
        List<NoiseRule> chain = new ArrayList<>();
        if (properties.ignoreAllHanzi()) {
            chain.add(NoiseRules.noHanzi());
        }
        if (properties.ignoreAllHiragana()) {
            chain.add(NoiseRules.noKana());
        }
        chain.add(NoiseRules.notAmount(symbolTable));
        chain.add(NoiseRules.minimumLength());
        chain.add(NoiseRules.asciiOnly());
        chain.add(NoiseRules.mostlyLetters());
        chain.add(NoiseRules.notIgnored(ignoreWordSet));
        this.rules = List.copyOf(chain);
        log.info("Noise filter chain: {}", rules);
    }

    public List<String> filter(List<String> tokens) {
        return tokens.stream().filter(this::accepts).toList();
    }

    List<NoiseRule> getRules() {
        return rules;
    }

    private boolean accepts(String token) {
        for (NoiseRule rule : rules) {
            if (!rule.accepts(token)) {
                log.debug("Dropped '{}' ({})", token, rule.name());
                return false;
            }
        }
        return true;
    }
}
