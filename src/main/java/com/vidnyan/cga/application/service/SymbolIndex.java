package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only lookup tables over every function, declaration and import of one build.
 * Built once by the assembler; shared by resolver threads without locking.
 */
public final class SymbolIndex {

    private static final Comparator<FunctionRecord> BY_LOCATION =
            Comparator.comparing(FunctionRecord::file).thenComparingInt(FunctionRecord::startLine);

    private final Map<String, FunctionRecord> functions;
    private final Map<String, List<FunctionRecord>> byQualifiedName;
    private final Map<String, List<FunctionRecord>> bySimpleName;
    private final Map<String, List<FunctionRecord>> byClass;
    private final Map<String, List<FunctionRecord>> byFile;
    private final Map<String, List<DeclarationEntry>> declarations;
    private final Map<String, List<ImportExtraction>> importsByFile;
    private final Map<String, Language> languageByFile;
    private final Set<String> files;

    /**
     * A declaration together with the file declaring it.
     */
    public record DeclarationEntry(String file, DeclarationExtraction declaration) {}

    private SymbolIndex(Map<String, FunctionRecord> functions,
                        Map<String, List<DeclarationEntry>> declarations,
                        Map<String, List<ImportExtraction>> importsByFile,
                        Map<String, Language> languageByFile) {
        this.functions = Collections.unmodifiableMap(functions);
        this.declarations = freeze(declarations);
        this.importsByFile = freeze(importsByFile);
        this.languageByFile = Map.copyOf(languageByFile);
        this.files = Collections.unmodifiableSet(new TreeSet<>(languageByFile.keySet()));

        Map<String, List<FunctionRecord>> qualified = new HashMap<>();
        Map<String, List<FunctionRecord>> simple = new HashMap<>();
        Map<String, List<FunctionRecord>> classes = new HashMap<>();
        Map<String, List<FunctionRecord>> perFile = new HashMap<>();
        functions.values().stream().sorted(BY_LOCATION).forEach(f -> {
            qualified.computeIfAbsent(f.qualifiedName(), k -> new ArrayList<>()).add(f);
            simple.computeIfAbsent(f.name(), k -> new ArrayList<>()).add(f);
            if (f.className() != null) {
                classes.computeIfAbsent(f.className(), k -> new ArrayList<>()).add(f);
            }
            perFile.computeIfAbsent(f.file(), k -> new ArrayList<>()).add(f);
        });
        this.byQualifiedName = freeze(qualified);
        this.bySimpleName = freeze(simple);
        this.byClass = freeze(classes);
        this.byFile = freeze(perFile);
    }

    public static SymbolIndex of(Map<String, FunctionRecord> functions,
                                 Map<String, List<DeclarationEntry>> declarations,
                                 Map<String, List<ImportExtraction>> importsByFile,
                                 Map<String, Language> languageByFile) {
        return new SymbolIndex(functions, declarations, importsByFile, languageByFile);
    }

    public Optional<FunctionRecord> function(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    public List<FunctionRecord> withQualifiedName(String qualifiedName) {
        return byQualifiedName.getOrDefault(qualifiedName, List.of());
    }

    public List<FunctionRecord> withSimpleName(String name) {
        return bySimpleName.getOrDefault(name, List.of());
    }

    public List<FunctionRecord> inClass(String className) {
        return byClass.getOrDefault(className, List.of());
    }

    public List<FunctionRecord> inFile(String file) {
        return byFile.getOrDefault(file, List.of());
    }

    public List<DeclarationEntry> declarationsNamed(String name) {
        return declarations.getOrDefault(name, List.of());
    }

    public boolean declares(String typeName) {
        return declarations.containsKey(typeName) || byClass.containsKey(typeName);
    }

    public List<ImportExtraction> importsOf(String file) {
        return importsByFile.getOrDefault(file, List.of());
    }

    public Set<String> files() {
        return files;
    }

    public int size() {
        return functions.size();
    }

    /**
     * Map an import source to a project file, if the import points inside the project.
     */
    public Optional<String> resolveModule(String fromFile, String source) {
        Language language = languageByFile.get(fromFile);
        if (language == null || source == null || source.isBlank()) {
            return Optional.empty();
        }
        return switch (language) {
            case JAVA -> resolveJavaType(source);
            case PYTHON -> resolvePythonModule(fromFile, source);
            case TYPESCRIPT, JAVASCRIPT -> resolveScriptModule(fromFile, source);
        };
    }

    private Optional<String> resolveJavaType(String source) {
        String path = source.replace('.', '/') + ".java";
        return files.stream()
                .filter(f -> f.equals(path) || f.endsWith("/" + path))
                .findFirst();
    }

    private Optional<String> resolvePythonModule(String fromFile, String source) {
        String modulePath;
        if (source.startsWith(".")) {
            int dots = 0;
            while (dots < source.length() && source.charAt(dots) == '.') {
                dots++;
            }
            String base = parentOf(fromFile);
            for (int i = 1; i < dots; i++) {
                base = parentOf(base);
            }
            String rest = source.substring(dots).replace('.', '/');
            modulePath = base.isEmpty() ? rest : (rest.isEmpty() ? base : base + "/" + rest);
            return firstExisting(List.of(modulePath + ".py", modulePath + "/__init__.py"));
        }
        modulePath = source.replace('.', '/');
        String asFile = modulePath + ".py";
        String asPackage = modulePath + "/__init__.py";
        return files.stream()
                .filter(f -> f.equals(asFile) || f.endsWith("/" + asFile)
                        || f.equals(asPackage) || f.endsWith("/" + asPackage))
                .findFirst();
    }

    private Optional<String> resolveScriptModule(String fromFile, String source) {
        if (!source.startsWith(".")) {
            return Optional.empty(); // package import
        }
        String joined = normalize(parentOf(fromFile), source);
        List<String> candidates = new ArrayList<>();
        candidates.add(joined);
        String stripped = joined.replaceAll("\\.(js|jsx|mjs|cjs)$", "");
        for (String ext : List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".mts", ".cts")) {
            candidates.add(stripped + ext);
        }
        for (String ext : List.of(".ts", ".tsx", ".js", ".jsx")) {
            candidates.add(joined + "/index" + ext);
        }
        return firstExisting(candidates);
    }

    private Optional<String> firstExisting(List<String> candidates) {
        return candidates.stream().filter(files::contains).findFirst();
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String normalize(String baseDir, String relative) {
        List<String> parts = new ArrayList<>();
        if (!baseDir.isEmpty()) {
            parts.addAll(List.of(baseDir.split("/")));
        }
        for (String segment : relative.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!parts.isEmpty()) {
                    parts.remove(parts.size() - 1);
                }
            } else {
                parts.add(segment);
            }
        }
        return String.join("/", parts);
    }

    private static <V> Map<String, List<V>> freeze(Map<String, List<V>> source) {
        Map<String, List<V>> copy = new HashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
