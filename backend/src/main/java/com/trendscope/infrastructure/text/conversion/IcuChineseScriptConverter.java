package com.trendscope.infrastructure.text.conversion;

import com.ibm.icu.text.Transliterator;
import com.trendscope.domain.analysis.service.ChineseScriptConverter;
import org.springframework.stereotype.Component;

/**
 * Traditional to simplified conversion with ICU's {@code Traditional-Simplified} transform.
 */
@Component
public class IcuChineseScriptConverter implements ChineseScriptConverter {

    private static final String TRANSFORM_ID = "Traditional-Simplified";

    private final ThreadLocal<Transliterator> transliterator =
            ThreadLocal.withInitial(() -> Transliterator.getInstance(TRANSFORM_ID));

    @Override
    public String toSimplified(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return transliterator.get().transliterate(text);
    }
}
