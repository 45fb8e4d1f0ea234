package com.trendscope.infrastructure.text.filter;

import com.trendscope.infrastructure.text.CharacterClasses;

import java.util.regex.Pattern;

/**
 * Factory for the rules of the noise filter chain.
 */
public final class NoiseRules {

    // Shorthand suffixes (1.2k, 5m, 3b, 2t) and separators (1,000 / 10-20)
    private static final Pattern AMOUNT_NOISE = Pattern.compile("[kmbt,-]");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z]");

    private static final int MIN_LATIN_LENGTH = 3;
    private static final double MIN_LETTER_SHARE = 0.6;

    private NoiseRules() {
    }

    public static NoiseRule noHanzi() {
        return NoiseRule.of("no-hanzi", token -> !CharacterClasses.containsHanzi(token));
    }

    public static NoiseRule noKana() {
        return NoiseRule.of("no-kana", token -> !CharacterClasses.containsKana(token));
    }

    /**
     * Rejects amounts such as {@code 1,000}, {@code 1.2k} or {@code $5m}.
     */
    public static NoiseRule notAmount(SymbolTable symbolTable) {
        return NoiseRule.of("not-amount", token -> {
            String bare = AMOUNT_NOISE.matcher(symbolTable.stripFiatSigns(token)).replaceAll("");
            return !CharacterClasses.isNumeric(bare);
        });
    }

    /**
     * Tokens without ideographs or kana need at least three characters.
     */
    public static NoiseRule minimumLength() {
        return NoiseRule.of("minimum-length", token -> CharacterClasses.containsHanzi(token)
                || CharacterClasses.containsKana(token)
                || token.length() >= MIN_LATIN_LENGTH);
    }

    public static NoiseRule asciiOnly() {
        return NoiseRule.of("ascii-only", CharacterClasses::isAllAscii);
    }

    /**
     * Letters a-z must make up more than 60% of the token (rounded down).
     */
    public static NoiseRule mostlyLetters() {
        return NoiseRule.of("mostly-letters", token -> {
            int letters = NON_LETTER.matcher(token).replaceAll("").length();
            return letters > Math.floor(token.length() * MIN_LETTER_SHARE);
        });
    }

    public static NoiseRule notIgnored(IgnoreWordSet ignoreWordSet) {
        return NoiseRule.of("not-ignored", token -> !ignoreWordSet.contains(token));
    }
}
