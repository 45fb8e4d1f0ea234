package com.trendscope.infrastructure.text.preprocessing;

import com.trendscope.domain.analysis.service.ChineseScriptConverter;
import com.trendscope.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes a raw post before segmentation:
 * - lowercase
 * - t.co short links removed
 * - literal replacements
 * - alias substitution on whole ASCII words
 * - {@code X's} expanded to {@code X is}
 * - traditional Chinese converted to simplified
 */
@Slf4j
@Component
public class PostNormalizer {

    // \w is ASCII-only, so ideographs next to a Latin word still leave a boundary
    private static final String WORD_BOUNDARY = "(?:(?<=\\w)(?!\\w)|(?<!\\w)(?=\\w))";

    private static final Pattern SHORT_LINK = Pattern.compile("https?://t\\.co/[a-zA-Z0-9.-]*");

    // Catches most "it's"/"he's" contractions; possessives are rewritten too
    private static final Pattern POSSESSIVE = Pattern.compile("(\\w)'s");

    private final ChineseScriptConverter scriptConverter;

    private final Map<String, String> replaces;
    private final Map<String, String> aliases;

    // null when the corresponding table is empty
    private final Pattern replacesPattern;
    private final Pattern aliasesPattern;

    public PostNormalizer(AnalysisProperties properties, ChineseScriptConverter scriptConverter) {
        this.scriptConverter = scriptConverter;
        this.replaces = properties.replaceTable();
        this.aliases = properties.aliasTable();
        this.replacesPattern = alternation(replaces, "", "");
        this.aliasesPattern = alternation(aliases, WORD_BOUNDARY + "(?:", ")" + WORD_BOUNDARY);
        log.info("Post normalizer ready: {} replacements, {} aliases", replaces.size(), aliases.size());
    }

    /**
     * Normalize a raw post.
     *
     * @param raw post text as fetched
     * @return normalized text, never null
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String result = raw.toLowerCase(Locale.ROOT);
        result = SHORT_LINK.matcher(result).replaceAll("");
        result = substitute(replacesPattern, replaces, result);
        result = substitute(aliasesPattern, aliases, result);
        result = POSSESSIVE.matcher(result).replaceAll("$1 is");
        return scriptConverter.toSimplified(result);
    }

    private static String substitute(Pattern pattern, Map<String, String> table, String text) {
        if (pattern == null) {
            return text;
        }
        return pattern.matcher(text).replaceAll(match -> Matcher.quoteReplacement(table.get(match.group())));
    }

    /**
     * Quotes every key and joins them longest first, so the longest key wins at a position.
     * The sort is stable: equal-length keys keep configuration order.
     */
    private static Pattern alternation(Map<String, String> table, String prefix, String suffix) {
        if (table.isEmpty()) {
            return null;
        }
        String alternatives = table.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile(prefix + alternatives + suffix);
    }
}
