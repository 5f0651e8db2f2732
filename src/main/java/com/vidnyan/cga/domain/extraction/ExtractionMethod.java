package com.vidnyan.cga.domain.extraction;

/**
 * Which kind of strategy produced an extraction result.
 */
public enum ExtractionMethod {
    STRUCTURAL,
    REGEX,
    HYBRID
}
