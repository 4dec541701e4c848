package com.hybridrag.lexical;

import java.util.Locale;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.SimpleAnalyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;

public final class LexicalAnalyzers {
    private LexicalAnalyzers() {
    }

    /**
     * {@code standard} lower-cases Unicode word tokens without stemming, {@code english} adds Porter stemming and
     * stop words, {@code simple} splits on non-letters, {@code whitespace} only splits.
     */
    public static Analyzer create(String name) {
        String normalized = name == null ? "standard" : name.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "standard" -> new StandardAnalyzer();
            case "english" -> new EnglishAnalyzer();
            case "simple" -> new SimpleAnalyzer();
            case "whitespace" -> new WhitespaceAnalyzer();
            default -> throw new IllegalArgumentException("Unknown analyzer: " + name);
        };
    }
}
