package com.trendscope.infrastructure.text.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trendscope.infrastructure.config.AnalysisConfigurationException;
import com.trendscope.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Static currency lookup table. The file is produced by an external fetch job;
 * only the fiat currency signs are used here, to strip them from amounts like {@code $5m}.
 */
@Slf4j
@Component
public class SymbolTable {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FiatCurrency(String name, String sign, String symbol) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(List<FiatCurrency> fiat) {}

    private final List<String> fiatSigns;

    // null when the table lists no signs
    private final Pattern fiatPattern;

    public SymbolTable(AnalysisProperties properties, ObjectMapper objectMapper) {
        Document document = read(properties.symbolTablePath(), objectMapper);
        List<FiatCurrency> fiat = document.fiat() == null ? List.of() : document.fiat();

        this.fiatSigns = fiat.stream()
                .map(FiatCurrency::sign)
                .filter(Objects::nonNull)
                .filter(sign -> !sign.isEmpty())
                .distinct()
                .toList();
        this.fiatPattern = fiatSigns.isEmpty() ? null
                : Pattern.compile(fiatSigns.stream().map(Pattern::quote).collect(Collectors.joining("|")));
        log.info("Symbol table loaded from {}: {} fiat currencies, {} distinct signs",
                properties.symbolTablePath().getDescription(), fiat.size(), fiatSigns.size());
    }

    List<String> getFiatSigns() {
        return fiatSigns;
    }

    public String stripFiatSigns(String text) {
        return fiatPattern == null ? text : fiatPattern.matcher(text).replaceAll("");
    }

    private static Document read(Resource resource, ObjectMapper objectMapper) {
        try (InputStream input = resource.getInputStream()) {
            Document document = objectMapper.readValue(input, Document.class);
            if (document == null) {
                throw new AnalysisConfigurationException("Symbol table is empty: " + resource.getDescription());
            }
            return document;
        } catch (IOException e) {
            throw new AnalysisConfigurationException("Failed to load symbol table: " + resource.getDescription(), e);
        }
    }
}
