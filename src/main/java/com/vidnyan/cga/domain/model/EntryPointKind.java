package com.vidnyan.cga.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a function can be invoked from outside the analyzed project.
 */
public enum EntryPointKind {
    HTTP_HANDLER,
    CLI_COMMAND,
    EVENT_HANDLER,
    TEST,
    SCHEDULED_JOB,
    MAIN,
    EXPORTED;

    @JsonValue
    public String tag() {
        return name().toLowerCase().replace('_', '-');
    }

    @JsonCreator
    public static EntryPointKind fromTag(String tag) {
        return valueOf(tag.toUpperCase().replace('-', '_'));
    }
}
