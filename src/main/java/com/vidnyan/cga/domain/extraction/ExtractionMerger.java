package com.vidnyan.cga.domain.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Deterministic merge of a primary and a fallback extraction of the same file.
 * Primary items are kept verbatim; fallback items are added only when their key is new.
 */
public final class ExtractionMerger {

    private ExtractionMerger() {
    }

    public static FileExtraction merge(FileExtraction primary, FileExtraction fallback) {
        List<String> errors = new ArrayList<>(primary.errors());
        errors.addAll(fallback.errors());

        return new FileExtraction(
                primary.file(),
                primary.language(),
                mergeItems(primary.functions(), fallback.functions(), FunctionExtraction::mergeKey),
                mergeItems(primary.calls(), fallback.calls(), CallExtraction::mergeKey),
                mergeItems(primary.imports(), fallback.imports(), ImportExtraction::mergeKey),
                mergeItems(primary.exports(), fallback.exports(), ExportExtraction::mergeKey),
                mergeItems(primary.declarations(), fallback.declarations(), DeclarationExtraction::mergeKey),
                mergeItems(primary.dataAccess(), fallback.dataAccess(), f -> f.table() + ":" + f.line()),
                errors,
                mergeQualities(primary.quality(), fallback.quality()));
    }

    static <T> List<T> mergeItems(List<T> primary, List<T> fallback, Function<T, String> key) {
        Set<String> seen = new LinkedHashSet<>();
        List<T> merged = new ArrayList<>(primary);
        primary.forEach(item -> seen.add(key.apply(item)));
        for (T item : fallback) {
            if (seen.add(key.apply(item))) {
                merged.add(item);
            }
        }
        return merged;
    }

    /**
     * Item-weighted combination of both confidences; always records that the fallback ran.
     */
    public static ExtractionQuality mergeQualities(ExtractionQuality primary, ExtractionQuality fallback) {
        int totalItems = primary.itemsExtracted() + fallback.itemsExtracted();
        double primaryWeight = totalItems > 0 ? (double) primary.itemsExtracted() / totalItems : 0.5;
        double fallbackWeight = 1.0 - primaryWeight;

        List<String> warnings = new ArrayList<>(primary.warnings());
        warnings.addAll(fallback.warnings());

        return new ExtractionQuality(
                ExtractionMethod.HYBRID,
                primary.confidence() * primaryWeight + fallback.confidence() * fallbackWeight,
                Math.max(primary.coveragePercent(), fallback.coveragePercent()),
                totalItems,
                primary.parseErrors() + fallback.parseErrors(),
                warnings,
                true,
                primary.extractionTimeMs() + fallback.extractionTimeMs());
    }
}
