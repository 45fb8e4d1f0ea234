package com.trendscope.infrastructure.text.matching;

import com.trendscope.domain.analysis.model.Segment;
import com.trendscope.infrastructure.config.AnalysisPropertiesFixture;
import com.trendscope.infrastructure.text.segmentation.IcuWordSegmenter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenRecognizerTest {

    private final IcuWordSegmenter segmenter = new IcuWordSegmenter();

    private TokenRecognizer recognizer(String... terms) {
        return new TokenRecognizer(new TermDictionary(
                AnalysisPropertiesFixture.builder().terms(terms).build(), segmenter));
    }

    private static Segment word(String text) {
        return new Segment(text, true);
    }

    private static Segment mark(String text) {
        return new Segment(text, false);
    }

    @Nested
    @DisplayName("Terms")
    class Terms {

        @Test
        @DisplayName("A configured phrase becomes one token")
        void phraseIsOneToken() {
            List<String> tokens = recognizer("stop loss").tokenize(segmenter.segment("btc stop loss now"));

            assertThat(tokens).containsExactly("btc", "stop loss", "now");
        }

        @Test
        @DisplayName("The longest matching term wins")
        void longestTermWins() {
            TokenRecognizer recognizer = recognizer("take profit", "take profit order");

            assertThat(recognizer.tokenize(segmenter.segment("take profit order now")))
                    .containsExactly("take profit order", "now");
            assertThat(recognizer.tokenize(segmenter.segment("take profit now")))
                    .containsExactly("take profit", "now");
        }

        @Test
        @DisplayName("Scanning resumes right after the consumed segments")
        void resumesAfterTerm() {
            List<Segment> segments = List.of(word("stop"), mark(" "), word("loss"), word("now"));

            assertThat(recognizer("stop loss").tokenize(segments)).containsExactly("stop loss", "now");
        }

        @Test
        @DisplayName("A term cut off by the end of the post is not matched")
        void truncatedTerm() {
            assertThat(recognizer("stop loss").tokenize(segmenter.segment("set a stop")))
                    .containsExactly("set", "a", "stop");
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        @DisplayName("Hashtag, mention and cashtag join with the following word")
        void tagsJoin() {
            List<Segment> segments = List.of(
                    mark("#"), word("btc"), mark(" "),
                    mark("@"), word("elonmusk"), mark(" "),
                    mark("$"), word("eth"));

            assertThat(recognizer().tokenize(segments)).containsExactly("#btc", "@elonmusk", "$eth");
        }

        @Test
        @DisplayName("A tag followed by a number is dropped along with the number")
        void tagBeforeNumber() {
            List<Segment> segments = List.of(mark("$"), word("100"));

            assertThat(recognizer().tokenize(segments)).isEmpty();
        }

        @Test
        @DisplayName("A dangling tag yields nothing")
        void danglingTag() {
            assertThat(recognizer().tokenize(List.of(word("gm"), mark(" "), mark("#")))).containsExactly("gm");
            assertThat(recognizer().tokenize(List.of(mark("@"), mark(" "), word("moon")))).containsExactly("moon");
        }
    }

    @Nested
    @DisplayName("Hyphen compounds")
    class Compounds {

        @Test
        @DisplayName("A word-hyphen chain becomes one token")
        void chain() {
            List<Segment> segments = List.of(
                    word("state"), mark("-"), word("of"), mark("-"),
                    word("the"), mark("-"), word("art"));

            assertThat(recognizer().tokenize(segments)).containsExactly("state-of-the-art");
        }

        @Test
        @DisplayName("A trailing hyphen ends the chain")
        void trailingHyphen() {
            List<Segment> segments = List.of(word("layer"), mark("-"), word("two"), mark("-"), mark(" "), word("chain"));

            assertThat(recognizer().tokenize(segments)).containsExactly("layer-two", "chain");
        }

        @Test
        @DisplayName("A word followed by a lone hyphen stays a plain word")
        void loneHyphen() {
            List<Segment> segments = List.of(word("well"), mark("-"));

            assertThat(recognizer().tokenize(segments)).containsExactly("well");
        }
    }

    @Test
    @DisplayName("Numbers, punctuation and whitespace produce no tokens")
    void noiseSkipped() {
        List<Segment> segments = List.of(word("2024"), mark(" "), mark("!"), word("3.5"), mark(" "), word("moon"));

        assertThat(recognizer().tokenize(segments)).containsExactly("moon");
    }

    @Test
    @DisplayName("Empty input gives no tokens")
    void emptyInput() {
        assertThat(recognizer("stop loss").tokenize(List.of())).isEmpty();
    }
}
