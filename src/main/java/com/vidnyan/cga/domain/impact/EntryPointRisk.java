package com.vidnyan.cga.domain.impact;

import com.vidnyan.cga.domain.graph.Sensitivity;

/**
 * Risk of a change as seen from one affected entry point, scored 0 to 100.
 * {@code highestSensitivity} is {@link Sensitivity#UNKNOWN} when no sensitive data is reached.
 */
public record EntryPointRisk(
    String entryPointId,
    String qualifiedName,
    int depth,
    int sensitiveDataPaths,
    Sensitivity highestSensitivity,
    int riskScore
) {}
