package com.trendscope.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analysis tables bound from the {@code analysis.*} namespace.
 *
 * @param replaces          literal replacements applied to the lowercased post
 * @param aliases           canonical spellings, applied to text and to tokens
 * @param terms             multi-word phrases recognized as single tokens
 * @param hanziPercentage   share of ideograph tokens a post must exceed to count as Chinese
 * @param ignoreAllHanzi    drop every token containing an ideograph
 * @param ignoreAllHiragana drop every token containing kana or CJK symbols
 * @param ignoreListPath    newline-delimited base ignore words
 * @param symbolTablePath   currency symbol table (JSON)
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public record AnalysisProperties(
        @Valid List<TextPair> replaces,
        @Valid List<TextPair> aliases,
        List<String> terms,
        @DecimalMin("0.0") @DecimalMax("1.0") double hanziPercentage,
        boolean ignoreAllHanzi,
        boolean ignoreAllHiragana,
        @NotNull Resource ignoreListPath,
        @NotNull Resource symbolTablePath
) {

    public AnalysisProperties {
        replaces = replaces == null ? List.of() : List.copyOf(replaces);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    /**
     * A {@code from -> to} rewrite.
     */
    public record TextPair(@NotEmpty String from, @NotNull String to) {}

    public Map<String, String> replaceTable() {
        return toTable("replaces", replaces);
    }

    public Map<String, String> aliasTable() {
        return toTable("aliases", aliases);
    }

    private static Map<String, String> toTable(String name, List<TextPair> pairs) {
        Map<String, String> table = new LinkedHashMap<>();
        for (TextPair pair : pairs) {
            if (pair == null || pair.from() == null || pair.from().isEmpty() || pair.to() == null) {
                throw new AnalysisConfigurationException("analysis." + name + " contains an incomplete entry: " + pair);
            }
            if (table.containsKey(pair.from())) {
                throw new AnalysisConfigurationException("analysis." + name + " declares '" + pair.from() + "' twice");
            }
            table.put(pair.from(), pair.to());
        }
        return Collections.unmodifiableMap(table);
    }
}
