package com.vidnyan.cga.domain.graph;

/**
 * Classifies tables and fields by how sensitive the data behind them is.
 */
public interface SensitivityClassifier {

    /**
     * @param table table name
     * @param field field name, or null to classify the table as a whole
     */
    Sensitivity classify(String table, String field);

    static SensitivityClassifier none() {
        return (table, field) -> Sensitivity.UNKNOWN;
    }
}
