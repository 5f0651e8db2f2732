package com.vidnyan.cga.domain.model;

/**
 * Declared parameter of a function.
 */
public record Parameter(
    String name,
    String type,
    boolean hasDefault,
    boolean rest
) {

    public static Parameter of(String name, String type) {
        return new Parameter(name, type, false, false);
    }
}
