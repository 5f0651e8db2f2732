package com.vidnyan.cga.domain.impact;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative severity of a change's downstream effect.
 */
public enum BlastRadius {
    MINIMAL,
    MODERATE,
    SIGNIFICANT,
    SEVERE;

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }
}
