package com.vidnyan.cga.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of reasons a call site is deliberately left unresolved.
 * Consumers use it to tell "we don't know" apart from "the target is not in this project".
 */
public enum UnresolvedReason {
    DYNAMIC_DISPATCH("dynamic-dispatch"),
    REFLECTION("reflection"),
    EVAL("eval"),
    EXTERNAL_LIBRARY("external-library"),
    COMPUTED_NAME("computed-name"),
    HIGHER_ORDER("higher-order"),
    PLUGIN_SYSTEM("plugin-system");

    private final String tag;

    UnresolvedReason(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static UnresolvedReason fromTag(String tag) {
        return Arrays.stream(values())
                .filter(r -> r.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown unresolved reason: " + tag));
    }
}
