package com.trendscope.infrastructure.text.filter;

import java.util.function.Predicate;

/**
 * One exclusion criterion of the noise filter. A token survives the filter only
 * when every rule of the chain accepts it.
 */
public interface NoiseRule {

    String name();

    boolean accepts(String token);

    static NoiseRule of(String name, Predicate<String> accepts) {
        return new NoiseRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean accepts(String token) {
                return accepts.test(token);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
