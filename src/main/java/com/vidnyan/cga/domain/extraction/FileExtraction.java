package com.vidnyan.cga.domain.extraction;

import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.Language;

import java.util.List;

/**
 * Raw facts extracted from one source file plus a quality report.
 */
public record FileExtraction(
    String file,
    Language language,
    List<FunctionExtraction> functions,
    List<CallExtraction> calls,
    List<ImportExtraction> imports,
    List<ExportExtraction> exports,
    List<DeclarationExtraction> declarations,
    List<DataAccessFact> dataAccess,
    List<String> errors,
    ExtractionQuality quality
) {

    public FileExtraction {
        functions = functions == null ? List.of() : List.copyOf(functions);
        calls = calls == null ? List.of() : List.copyOf(calls);
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
        dataAccess = dataAccess == null ? List.of() : List.copyOf(dataAccess);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Result for a file no strategy could handle.
     */
    public static FileExtraction failed(String file, Language language, List<String> errors,
                                        ExtractionQuality quality) {
        return new FileExtraction(file, language, List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), errors, quality);
    }

    public int itemCount() {
        return functions.size() + calls.size() + imports.size() + exports.size() + declarations.size();
    }

    public boolean failedCompletely() {
        return !errors.isEmpty() && itemCount() == 0;
    }

    public FileExtraction withFile(String relativePath) {
        return new FileExtraction(relativePath, language, functions, calls, imports, exports, declarations,
                dataAccess, errors, quality);
    }

    public FileExtraction withDataAccess(List<DataAccessFact> facts) {
        return new FileExtraction(file, language, functions, calls, imports, exports, declarations,
                facts, errors, quality);
    }

    public FileExtraction withErrors(List<String> allErrors, ExtractionQuality newQuality) {
        return new FileExtraction(file, language, functions, calls, imports, exports, declarations,
                dataAccess, allErrors, newQuality);
    }

    public FileExtraction withQuality(ExtractionQuality newQuality) {
        return new FileExtraction(file, language, functions, calls, imports, exports, declarations,
                dataAccess, errors, newQuality);
    }
}
