package com.vidnyan.cga.application.port.out;

import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.model.EntryPointKind;

import java.util.Optional;

/**
 * Port for recognizing functions invoked from outside the project
 * (handlers, commands, tests, scheduled jobs, main methods).
 */
public interface EntryPointRegistry {

    /**
     * Classify a function, or return empty if it has no recognized entry-point shape.
     * "Exported with no known caller" is decided after resolution and never returned here.
     */
    Optional<EntryPointKind> classify(FunctionExtraction function, FileExtraction file);
}
