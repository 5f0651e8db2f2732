package com.vidnyan.cga.domain.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-file metadata describing how trustworthy an extraction is.
 * Feeds graph statistics only; queries never look at it.
 */
public record ExtractionQuality(
    ExtractionMethod method,
    double confidence,
    double coveragePercent,
    int itemsExtracted,
    int parseErrors,
    List<String> warnings,
    boolean usedFallback,
    long extractionTimeMs
) {

    public static final double STRUCTURAL_CONFIDENCE = 0.95;
    public static final double REGEX_CONFIDENCE = 0.75;
    public static final double UNKNOWN_CONFIDENCE = 0.25;

    public ExtractionQuality {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExtractionQuality of(ExtractionMethod method, int items, long elapsedMs) {
        double confidence = method == ExtractionMethod.STRUCTURAL ? STRUCTURAL_CONFIDENCE : REGEX_CONFIDENCE;
        return new ExtractionQuality(method, confidence, items > 0 ? 100.0 : 0.0, items, 0, List.of(), false, elapsedMs);
    }

    /**
     * Quality of a file that no strategy could extract.
     */
    public static ExtractionQuality failed(ExtractionMethod method, List<String> warnings, long elapsedMs) {
        return new ExtractionQuality(method, 0.0, 0.0, 0, 1, warnings, false, elapsedMs);
    }

    public ExtractionQuality withWarning(String warning) {
        List<String> all = new ArrayList<>(warnings);
        all.add(warning);
        return new ExtractionQuality(method, confidence, coveragePercent, itemsExtracted, parseErrors,
                all, usedFallback, extractionTimeMs);
    }

    public ExtractionQuality withFallbackUsed(long elapsedMs) {
        return new ExtractionQuality(method, confidence, coveragePercent, itemsExtracted, parseErrors,
                warnings, true, elapsedMs);
    }

    public ExtractionQuality withExtractionTime(long elapsedMs) {
        return new ExtractionQuality(method, confidence, coveragePercent, itemsExtracted, parseErrors,
                warnings, usedFallback, elapsedMs);
    }

    public ExtractionQuality withParseErrors(int errors) {
        double degraded = errors > 0 ? confidence * 0.8 : confidence;
        return new ExtractionQuality(method, degraded, coveragePercent, itemsExtracted, errors,
                warnings, usedFallback, extractionTimeMs);
    }
}
