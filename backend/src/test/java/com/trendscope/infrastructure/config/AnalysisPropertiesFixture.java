package com.trendscope.infrastructure.config;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link AnalysisProperties} for unit tests, backed by the files under {@code fixtures/}.
 */
public final class AnalysisPropertiesFixture {

    public static final Resource IGNORE_LIST = new ClassPathResource("fixtures/ignore-words.txt");
    public static final Resource SYMBOL_TABLE = new ClassPathResource("fixtures/symbols.json");

    private final List<AnalysisProperties.TextPair> replaces = new ArrayList<>();
    private final List<AnalysisProperties.TextPair> aliases = new ArrayList<>();
    private final List<String> terms = new ArrayList<>();
    private double hanziPercentage = 0.5;
    private boolean ignoreAllHanzi;
    private boolean ignoreAllHiragana;
    private Resource ignoreList = IGNORE_LIST;
    private Resource symbolTable = SYMBOL_TABLE;

    private AnalysisPropertiesFixture() {
    }

    public static AnalysisPropertiesFixture builder() {
        return new AnalysisPropertiesFixture();
    }

    public static AnalysisProperties defaults() {
        return builder().build();
    }

    public AnalysisPropertiesFixture replace(String from, String to) {
        replaces.add(new AnalysisProperties.TextPair(from, to));
        return this;
    }

    public AnalysisPropertiesFixture alias(String from, String to) {
        aliases.add(new AnalysisProperties.TextPair(from, to));
        return this;
    }

    public AnalysisPropertiesFixture terms(String... phrases) {
        terms.addAll(List.of(phrases));
        return this;
    }

    public AnalysisPropertiesFixture hanziPercentage(double value) {
        this.hanziPercentage = value;
        return this;
    }

    public AnalysisPropertiesFixture ignoreAllHanzi(boolean value) {
        this.ignoreAllHanzi = value;
        return this;
    }

    public AnalysisPropertiesFixture ignoreAllHiragana(boolean value) {
        this.ignoreAllHiragana = value;
        return this;
    }

    public AnalysisPropertiesFixture ignoreList(Resource resource) {
        this.ignoreList = resource;
        return this;
    }

    public AnalysisPropertiesFixture symbolTable(Resource resource) {
        this.symbolTable = resource;
        return this;
    }

    public AnalysisProperties build() {
        return new AnalysisProperties(replaces, aliases, terms, hanziPercentage,
                ignoreAllHanzi, ignoreAllHiragana, ignoreList, symbolTable);
    }
}
