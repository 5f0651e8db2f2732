package com.vidnyan.cga.domain.extraction;

import java.util.List;

/**
 * An import statement. {@code source} is the module path or fully qualified type as written.
 */
public record ImportExtraction(
    String source,
    List<ImportedName> names,
    int line,
    boolean staticImport
) {

    public ImportExtraction {
        names = names == null ? List.of() : List.copyOf(names);
    }

    /**
     * One name brought into scope. {@code namespace} marks a whole-module binding
     * such as {@code import * as x} or a Python {@code import pkg}.
     */
    public record ImportedName(
        String imported,
        String local,
        boolean namespace
    ) {

        public static ImportedName of(String name) {
            return new ImportedName(name, name, false);
        }

        public static ImportedName aliased(String imported, String local) {
            return new ImportedName(imported, local, false);
        }

        public static ImportedName namespaceOf(String local) {
            return new ImportedName("*", local, true);
        }
    }

    public String mergeKey() {
        return source + ":" + line;
    }
}
