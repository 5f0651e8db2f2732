package com.vidnyan.cga.domain.impact;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of proposed change to a symbol.
 */
public enum ChangeKind {
    RENAME("rename", true),
    CHANGE_SIGNATURE("change-signature", true),
    CHANGE_RETURN_TYPE("change-return-type", true),
    DELETE("delete", true),
    MODIFY_BODY("modify-body", false);

    private final String tag;
    private final boolean signatureIncompatible;

    ChangeKind(String tag, boolean signatureIncompatible) {
        this.tag = tag;
        this.signatureIncompatible = signatureIncompatible;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Whether existing call sites stop compiling or working after this change.
     */
    public boolean signatureIncompatible() {
        return signatureIncompatible;
    }

    @JsonCreator
    public static ChangeKind fromTag(String tag) {
        return Arrays.stream(values())
                .filter(k -> k.tag.equalsIgnoreCase(tag) || k.name().equalsIgnoreCase(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown change kind: " + tag));
    }
}
