package com.trendscope.infrastructure.text.segmentation;

import com.trendscope.domain.analysis.model.Segment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class IcuWordSegmenterTest {

    private IcuWordSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new IcuWordSegmenter();
    }

    @Test
    @DisplayName("null and empty input yield no segments")
    void emptyInput() {
        assertThat(segmenter.segment(null)).isEmpty();
        assertThat(segmenter.segment("")).isEmpty();
    }

    @Test
    @DisplayName("Whitespace separates word-like segments")
    void wordsAndSpaces() {
        assertThat(segmenter.segment("stop loss")).containsExactly(
                new Segment("stop", true),
                new Segment(" ", false),
                new Segment("loss", true));
    }

    @Test
    @DisplayName("Tag characters are separate non-word segments")
    void tagIsSeparate() {
        List<Segment> segments = segmenter.segment("#btc");

        assertThat(segments).containsExactly(
                new Segment("#", false),
                new Segment("btc", true));
    }

    @Test
    @DisplayName("Hyphens split compounds into words and separators")
    void hyphenatedCompound() {
        List<Segment> segments = segmenter.segment("state-of-the-art");

        assertThat(segments).extracting(Segment::text)
                .containsExactly("state", "-", "of", "-", "the", "-", "art");
        assertThat(segments).extracting(Segment::wordLike)
                .containsExactly(true, false, true, false, true, false, true);
    }

    @Test
    @DisplayName("Numbers are word-like")
    void numbersAreWordLike() {
        assertThat(segmenter.segment("42")).containsExactly(new Segment("42", true));
    }

    @Test
    @DisplayName("Chinese text is split into word-like segments covering the input")
    void chineseText() {
        String text = "比特币又涨了";
        List<Segment> segments = segmenter.segment(text);

        assertThat(segments).isNotEmpty();
        assertThat(segments).allMatch(Segment::wordLike);
        assertThat(segments.stream().map(Segment::text).collect(Collectors.joining())).isEqualTo(text);
    }

    @Test
    @DisplayName("Segments concatenate back to the input")
    void lossless() {
        String text = "gm frens! $eth to 3.2k, wen moon? 比特币 🚀";

        String joined = segmenter.segment(text).stream().map(Segment::text).collect(Collectors.joining());

        assertThat(joined).isEqualTo(text);
    }
}
