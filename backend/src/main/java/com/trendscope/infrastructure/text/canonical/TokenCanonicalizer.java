package com.trendscope.infrastructure.text.canonical;

import com.trendscope.infrastructure.config.AnalysisProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps tokens to their canonical spelling and drops repeats, keeping first-seen order.
 * Aliases are applied once, never chained.
 */
@Component
public class TokenCanonicalizer {

    private final Map<String, String> aliases;

    public TokenCanonicalizer(AnalysisProperties properties) {
        this.aliases = properties.aliasTable();
    }

    public List<String> canonicalize(List<String> tokens) {
        Set<String> unique = new LinkedHashSet<>();
        for (String token : tokens) {
            unique.add(aliases.getOrDefault(token, token));
        }
        return List.copyOf(unique);
    }
}
