package com.vidnyan.cga.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Source languages the call graph can be built for.
 */
public enum Language {
    JAVA("java", List.of(".java")),
    PYTHON("python", List.of(".py")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx", ".mts", ".cts")),
    JAVASCRIPT("javascript", List.of(".js", ".jsx", ".mjs", ".cjs"));

    private final String tag;
    private final List<String> extensions;

    Language(String tag, List<String> extensions) {
        this.tag = tag;
        this.extensions = extensions;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public List<String> extensions() {
        return extensions;
    }

    @JsonCreator
    public static Language fromTag(String tag) {
        return Arrays.stream(values())
                .filter(l -> l.tag.equalsIgnoreCase(tag) || l.name().equalsIgnoreCase(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + tag));
    }

    /**
     * Detect the language of a file from its extension.
     */
    public static Optional<Language> forFileName(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".d.ts")) {
            return Optional.empty(); // declarations only, nothing callable
        }
        return Arrays.stream(values())
                .filter(l -> l.extensions.stream().anyMatch(lower::endsWith))
                .findFirst();
    }
}
