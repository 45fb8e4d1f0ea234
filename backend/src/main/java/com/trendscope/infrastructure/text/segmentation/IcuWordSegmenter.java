package com.trendscope.infrastructure.text.segmentation;

import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;
import com.trendscope.domain.analysis.model.Segment;
import com.trendscope.domain.analysis.service.WordSegmenter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Word segmentation backed by ICU word boundaries.
 * Han runs are split with ICU's dictionary, everything else with the UAX #29 rules.
 * A segment is word-like when its rule status is outside the "none" range
 * (numbers, letters, kana and ideographs).
 */
@Component
public class IcuWordSegmenter implements WordSegmenter {

    // BreakIterator keeps per-text state, so every call works on its own clone
    private final BreakIterator prototype = BreakIterator.getWordInstance(ULocale.ROOT);

    @Override
    public List<Segment> segment(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        BreakIterator words = (BreakIterator) prototype.clone();
        words.setText(text);

        List<Segment> segments = new ArrayList<>();
        int start = words.first();
        for (int end = words.next(); end != BreakIterator.DONE; start = end, end = words.next()) {
            boolean wordLike = words.getRuleStatus() >= BreakIterator.WORD_NONE_LIMIT;
            segments.add(new Segment(text.substring(start, end), wordLike));
        }
        return segments;
    }
}
