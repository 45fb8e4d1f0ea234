package com.trendscope.infrastructure.text.matching;

import com.trendscope.domain.analysis.model.Segment;
import com.trendscope.infrastructure.text.CharacterClasses;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a segment sequence into tokens with a single left-to-right scan.
 *
 * At each position, in priority order:
 *   1. longest configured term (windows of maxTermLength down to 2 segments)
 *   2. tag + handle: {@code @name}, {@code #tag}, {@code $symbol}
 *   3. hyphen compound: {@code word-word-word}
 *   4. plain word (word-like, not numeric)
 * Anything else (whitespace, punctuation, bare numbers) yields no token.
 */
@Component
@RequiredArgsConstructor
public class TokenRecognizer {

    private static final Set<String> TAGS = Set.of("@", "#", "$");
    private static final String HYPHEN = "-";

    private final TermDictionary termDictionary;

    public List<String> tokenize(List<Segment> segments) {
        List<String> tokens = new ArrayList<>();
        int index = 0;
        while (index < segments.size()) {
            int consumed = matchTerm(segments, index, tokens);
            if (consumed == 0) {
                consumed = matchTag(segments, index, tokens);
            }
            if (consumed == 0) {
                consumed = matchCompound(segments, index, tokens);
            }
            if (consumed == 0) {
                consumed = matchWord(segments, index, tokens);
            }
            index += Math.max(consumed, 1);
        }
        return tokens;
    }

    private int matchTerm(List<Segment> segments, int index, List<String> tokens) {
        for (int size = termDictionary.getMaxTermLength(); size > 1; size--) {
            Optional<String> term = termDictionary.match(segments, index, size);
            if (term.isPresent()) {
                tokens.add(term.get());
                return size;
            }
        }
        return 0;
    }

    private int matchTag(List<Segment> segments, int index, List<String> tokens) {
        Segment next = at(segments, index + 1);
        if (!TAGS.contains(segments.get(index).text()) || next == null || !next.wordLike()
                || CharacterClasses.isNumeric(next.text())) {
            return 0;
        }
        tokens.add(segments.get(index).text() + next.text());
        return 2;
    }

    private int matchCompound(List<Segment> segments, int index, List<String> tokens) {
        Segment first = segments.get(index);
        if (!first.wordLike() || !isHyphen(at(segments, index + 1))) {
            return 0;
        }

        StringBuilder compound = new StringBuilder(first.text());
        int last = index;
        while (isHyphen(at(segments, last + 1)) && isWordLike(at(segments, last + 2))) {
            compound.append(HYPHEN).append(segments.get(last + 2).text());
            last += 2;
        }
        tokens.add(compound.toString());
        return last - index + 1;
    }

    private int matchWord(List<Segment> segments, int index, List<String> tokens) {
        Segment segment = segments.get(index);
        if (!segment.wordLike() || CharacterClasses.isNumeric(segment.text())) {
            return 0;
        }
        tokens.add(segment.text());
        return 1;
    }

    private static Segment at(List<Segment> segments, int index) {
        return index < segments.size() ? segments.get(index) : null;
    }

    private static boolean isHyphen(Segment segment) {
        return segment != null && HYPHEN.equals(segment.text());
    }

    private static boolean isWordLike(Segment segment) {
        return segment != null && segment.wordLike();
    }
}
