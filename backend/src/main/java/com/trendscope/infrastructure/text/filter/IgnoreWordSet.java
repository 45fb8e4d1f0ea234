package com.trendscope.infrastructure.text.filter;

import com.trendscope.infrastructure.config.AnalysisConfigurationException;
import com.trendscope.infrastructure.config.AnalysisProperties;
import lombok.extern.slf4j.Slf4j;
import org.atteo.evo.inflector.English;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stop words excluded from filtered output. Each base word of the list file is expanded
 * with its plural and the common "-ing", "-d" and "-ed" spellings, misspellings included:
 * {@code run} also excludes {@code runs}, {@code runing}, {@code ruing}, {@code running},
 * {@code rund} and {@code runed}.
 */
@Slf4j
@Component
public class IgnoreWordSet {

    private static final String VOWELS = "aeiou";

    private final Set<String> words;

    public IgnoreWordSet(AnalysisProperties properties) {
        Resource resource = properties.ignoreListPath();
        Set<String> expanded = new HashSet<>();
        for (String base : readBaseWords(resource)) {
            expanded.addAll(variants(base));
        }
        this.words = Set.copyOf(expanded);
        log.info("Ignore list loaded from {}: {} words after expansion", resource.getDescription(), words.size());
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    static List<String> variants(String base) {
        String stem = base.substring(0, base.length() - 1);
        List<String> variants = new ArrayList<>(List.of(
                base,
                English.plural(base),
                base + "ing",
                stem + "ing"
        ));
        if (endsConsonantVowelConsonant(base)) {
            variants.add(base + base.charAt(base.length() - 1) + "ing");
        }
        variants.add(base + "d");
        variants.add(base + "ed");
        return variants;
    }

    // run -> running, stop -> stopping; w, x and y are never doubled
    private static boolean endsConsonantVowelConsonant(String word) {
        int length = word.length();
        if (length < 3) {
            return false;
        }
        char last = word.charAt(length - 1);
        return isConsonant(word.charAt(length - 3))
                && VOWELS.indexOf(word.charAt(length - 2)) >= 0
                && isConsonant(last)
                && "wxy".indexOf(last) < 0;
    }

    private static boolean isConsonant(char c) {
        return c >= 'a' && c <= 'z' && VOWELS.indexOf(c) < 0;
    }

    private static List<String> readBaseWords(Resource resource) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(line -> line.startsWith("\uFEFF") ? line.substring(1) : line)
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new AnalysisConfigurationException("Failed to load ignore list: " + resource.getDescription(), e);
        }
    }
}
