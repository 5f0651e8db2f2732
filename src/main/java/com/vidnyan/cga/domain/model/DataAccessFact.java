package com.vidnyan.cga.domain.model;

import java.util.List;

/**
 * A direct access to a table (and optionally some of its fields) found inside a function body.
 */
public record DataAccessFact(
    String table,
    List<String> fields,
    DataOperation operation,
    String file,
    int line,
    double confidence
) {

    public DataAccessFact {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * Whether this fact touches the given table and, if a field is given, that field.
     */
    public boolean matches(String targetTable, String targetField) {
        if (!table.equalsIgnoreCase(targetTable)) {
            return false;
        }
        return targetField == null || fields.stream().anyMatch(f -> f.equalsIgnoreCase(targetField));
    }
}
