package com.vidnyan.cga.domain.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sensitivity class of a table or field. Ordered from most to least sensitive.
 */
public enum Sensitivity {
    CREDENTIALS(15),
    FINANCIAL(12),
    HEALTH(10),
    PII(5),
    UNKNOWN(0);

    private final int riskWeight;

    Sensitivity(int riskWeight) {
        this.riskWeight = riskWeight;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase();
    }

    /**
     * Points one path to data of this class adds to an impact risk score.
     */
    public int riskWeight() {
        return riskWeight;
    }

    public boolean sensitive() {
        return this != UNKNOWN;
    }
}
