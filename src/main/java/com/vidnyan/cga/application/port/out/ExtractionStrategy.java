package com.vidnyan.cga.application.port.out;

import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.Language;

/**
 * Port for a per-language extraction strategy.
 * Implementations must be stateless so one instance can serve every worker thread.
 */
public interface ExtractionStrategy {

    Language language();

    ExtractionMethod method();

    /**
     * Extract raw facts from one file.
     * @param source file contents
     * @param file path relative to the project root
     * @throws com.vidnyan.cga.domain.extraction.ExtractionException if the file cannot be parsed
     */
    FileExtraction extract(String source, String file);
}
