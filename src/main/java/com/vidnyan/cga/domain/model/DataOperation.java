package com.vidnyan.cga.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of operation a data-access fact performs on a table.
 */
public enum DataOperation {
    READ,
    WRITE,
    DELETE,
    UNKNOWN;

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DataOperation fromTag(String tag) {
        return valueOf(tag.toUpperCase());
    }
}
