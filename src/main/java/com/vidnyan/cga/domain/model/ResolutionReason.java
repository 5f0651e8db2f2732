package com.vidnyan.cga.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Why a call reference was matched the way it was.
 */
public enum ResolutionReason {
    SAME_CLASS("same-class"),
    SAME_FILE("same-file"),
    IMPORT("import"),
    DECLARED_TYPE("declared-type"),
    INFERRED_TYPE("inferred-type"),
    INHERITED("inherited"),
    CONSTRUCTOR("constructor"),
    OVERLOAD_TIE("overload-tie"),
    GLOBAL_UNIQUE("global-unique"),
    GLOBAL_AMBIGUOUS("global-ambiguous"),
    DYNAMIC_SHAPE("dynamic-shape"),
    NO_CANDIDATE("no-candidate");

    private final String tag;

    ResolutionReason(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static ResolutionReason fromTag(String tag) {
        return Arrays.stream(values())
                .filter(r -> r.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resolution reason: " + tag));
    }
}
