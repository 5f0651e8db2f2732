package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationKind;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.ExtractionQuality;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction.ImportedName;
import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.Language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hand-written extraction results for assembler and resolver tests.
 */
final class ExtractionFixture {

    private final String file;
    private final List<FunctionExtraction> functions = new ArrayList<>();
    private final List<CallExtraction> calls = new ArrayList<>();
    private final List<ImportExtraction> imports = new ArrayList<>();
    private final List<DeclarationExtraction> declarations = new ArrayList<>();
    private final List<DataAccessFact> dataAccess = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private ExtractionQuality quality = ExtractionQuality.of(ExtractionMethod.REGEX, 1, 0);

    private ExtractionFixture(String file) {
        this.file = file;
    }

    static ExtractionFixture file(String file) {
        return new ExtractionFixture(file);
    }

    ExtractionFixture function(FunctionExtraction.Builder function) {
        functions.add(function.build());
        return this;
    }

    ExtractionFixture call(CallExtraction.Builder call) {
        calls.add(call.build());
        return this;
    }

    ExtractionFixture namedImport(String source, String... names) {
        imports.add(new ImportExtraction(source, Arrays.stream(names).map(ImportedName::of).toList(), 1, false));
        return this;
    }

    ExtractionFixture aliasedImport(String source, String imported, String local) {
        imports.add(new ImportExtraction(source, List.of(ImportedName.aliased(imported, local)), 1, false));
        return this;
    }

    ExtractionFixture namespaceImport(String source, String local) {
        imports.add(new ImportExtraction(source, List.of(ImportedName.namespaceOf(local)), 1, false));
        return this;
    }

    ExtractionFixture type(String name, int startLine, int endLine, String... baseTypes) {
        declarations.add(new DeclarationExtraction(name, DeclarationKind.CLASS, startLine, endLine,
                List.of(baseTypes), List.of(), true));
        return this;
    }

    ExtractionFixture access(DataAccessFact fact) {
        dataAccess.add(fact);
        return this;
    }

    ExtractionFixture error(String error) {
        errors.add(error);
        return this;
    }

    ExtractionFixture quality(ExtractionQuality quality) {
        this.quality = quality;
        return this;
    }

    FileExtraction build() {
        return new FileExtraction(file, Language.forFileName(file).orElseThrow(), functions, calls, imports,
                List.of(), declarations, dataAccess, errors, quality);
    }

    static FunctionExtraction.Builder fn(String name, int startLine, int endLine) {
        return FunctionExtraction.builder().name(name).startLine(startLine).endLine(endLine);
    }

    static CallExtraction.Builder call(String name, int line) {
        return CallExtraction.builder().calleeName(name).line(line).column(5);
    }
}
