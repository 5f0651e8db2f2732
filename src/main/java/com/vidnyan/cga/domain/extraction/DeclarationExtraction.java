package com.vidnyan.cga.domain.extraction;

import java.util.List;

/**
 * A type declaration (class, interface, enum or record).
 * {@code baseTypes} lists simple names of extended or implemented types.
 */
public record DeclarationExtraction(
    String name,
    DeclarationKind kind,
    int startLine,
    int endLine,
    List<String> baseTypes,
    List<String> methods,
    boolean exported
) {

    public DeclarationExtraction {
        baseTypes = baseTypes == null ? List.of() : List.copyOf(baseTypes);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public String mergeKey() {
        return name + ":" + startLine;
    }
}
