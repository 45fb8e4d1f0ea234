package com.trendscope.infrastructure.text;

import com.ibm.icu.text.UnicodeSet;

import java.util.regex.Pattern;

/**
 * Character-class tests shared by the tokenizer, the language classifier and the noise filter.
 */
public final class CharacterClasses {

    // Han ideographs plus the ideographic closing mark and number zero
    private static final UnicodeSet HANZI = new UnicodeSet("[[:Unified_Ideograph:]\\u3006\\u3007]").freeze();

    // Kana, CJK symbols and punctuation, full-width forms, common CJK ideographs, stars, arrows, reference mark
    private static final Pattern KANA = Pattern.compile(
            "[\\u3000-\\u303F\\u3040-\\u309F\\u30A0-\\u30FF\\uFF00-\\uFFEF\\u4E00-\\u9FAF"
                    + "\\u2605-\\u2606\\u2190-\\u2195\\u203B]"
    );

    private static final Pattern ALL_ASCII = Pattern.compile("^[\\x00-\\x7F]+$");

    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(?:Infinity|(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)"
    );

    private static final Pattern RADIX_INTEGER = Pattern.compile("0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+");

    private CharacterClasses() {
    }

    public static boolean containsHanzi(String text) {
        return HANZI.containsSome(text);
    }

    public static boolean containsKana(String text) {
        return KANA.matcher(text).find();
    }

    public static boolean isAllAscii(String text) {
        return ALL_ASCII.matcher(text).matches();
    }

    /**
     * Whether the text reads as a number once surrounding whitespace is removed.
     * Blank text counts as zero. Accepts signed decimals with optional fraction and
     * exponent, {@code Infinity}, and unsigned hex, octal and binary integer literals.
     */
    public static boolean isNumeric(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return true;
        }
        return DECIMAL.matcher(stripped).matches() || RADIX_INTEGER.matcher(stripped).matches();
    }
}
