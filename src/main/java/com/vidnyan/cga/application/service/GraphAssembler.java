package com.vidnyan.cga.application.service;

import com.vidnyan.cga.application.port.out.EntryPointRegistry;
import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.extraction.DeclarationExtraction;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.extraction.FunctionExtraction;
import com.vidnyan.cga.domain.extraction.ImportExtraction;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.EntryPointKind;
import com.vidnyan.cga.domain.model.FunctionRecord;
import com.vidnyan.cga.domain.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns per-file extraction results into addressable function records and a symbol index.
 * Every call reference leaves here unresolved; the resolver fills in targets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphAssembler {

    private final EntryPointRegistry entryPointRegistry;

    public AssembledGraph assemble(String projectRoot, List<FileExtraction> extractions) {
        List<FileExtraction> ordered = extractions.stream()
                .sorted(Comparator.comparing(FileExtraction::file))
                .toList();

        Map<String, FunctionRecord> functions = new LinkedHashMap<>();
        Map<String, List<SymbolIndex.DeclarationEntry>> declarations = new HashMap<>();
        Map<String, List<ImportExtraction>> imports = new HashMap<>();
        Map<String, Language> languages = new HashMap<>();
        List<PendingCall> pending = new ArrayList<>();
        int duplicates = 0;
        int droppedCalls = 0;

        for (FileExtraction file : ordered) {
            languages.put(file.file(), file.language());
            imports.put(file.file(), file.imports());
            for (DeclarationExtraction declaration : file.declarations()) {
                declarations.computeIfAbsent(declaration.name(), k -> new ArrayList<>())
                        .add(new SymbolIndex.DeclarationEntry(file.file(), declaration));
            }

            List<Span> spans = new ArrayList<>();
            for (FunctionExtraction function : file.functions()) {
                String id = FunctionRecord.idOf(file.file(), function.qualifiedName(), function.startLine());
                if (functions.containsKey(id)) {
                    duplicates++;
                    log.debug("Skipping duplicate function id {}", id);
                    continue;
                }
                spans.add(new Span(id, function.startLine(), Math.max(function.startLine(), function.endLine())));
                functions.put(id, toRecord(id, function, file));
            }

            Map<String, List<CallExtraction>> callsByFunction = new LinkedHashMap<>();
            for (CallExtraction call : file.calls()) {
                Optional<Span> owner = innermost(spans, call.line());
                if (owner.isEmpty()) {
                    droppedCalls++;
                    continue;
                }
                callsByFunction.computeIfAbsent(owner.get().id(), k -> new ArrayList<>()).add(call);
            }

            Map<String, List<DataAccessFact>> factsByFunction = new HashMap<>();
            for (DataAccessFact fact : file.dataAccess()) {
                innermost(spans, fact.line()).ifPresent(owner ->
                        factsByFunction.computeIfAbsent(owner.id(), k -> new ArrayList<>()).add(fact));
            }

            for (Span span : spans) {
                FunctionRecord record = functions.get(span.id());
                List<CallExtraction> calls = callsByFunction.getOrDefault(span.id(), List.of()).stream()
                        .sorted(Comparator.comparingInt(CallExtraction::line).thenComparingInt(CallExtraction::column))
                        .toList();
                List<CallReference> references = calls.stream()
                        .map(call -> unresolvedReference(record, call))
                        .toList();
                FunctionRecord assembled = record.withCalls(references)
                        .withDataAccess(factsByFunction.getOrDefault(span.id(), List.of()));
                functions.put(span.id(), assembled);
                for (int i = 0; i < calls.size(); i++) {
                    pending.add(new PendingCall(references.get(i), calls.get(i), assembled, i));
                }
            }
        }

        if (duplicates > 0 || droppedCalls > 0) {
            log.debug("Assembly skipped {} duplicate functions and {} calls outside any function",
                    duplicates, droppedCalls);
        }

        SymbolIndex index = SymbolIndex.of(functions, declarations, imports, languages);
        log.info("Assembled {} functions, {} call sites from {} files",
                functions.size(), pending.size(), ordered.size());

        return new AssembledGraph(projectRoot, functions, index, pending, summarize(ordered));
    }

    private FunctionRecord toRecord(String id, FunctionExtraction function, FileExtraction file) {
        EntryPointKind kind = entryPointRegistry.classify(function, file).orElse(null);
        return FunctionRecord.builder()
                .id(id)
                .name(function.name())
                .qualifiedName(function.qualifiedName())
                .file(file.file())
                .startLine(function.startLine())
                .endLine(Math.max(function.startLine(), function.endLine()))
                .language(file.language())
                .className(function.className())
                .exported(function.exported())
                .constructor(function.constructor())
                .async(function.async())
                .decorators(function.decorators())
                .parameters(function.parameters())
                .returnType(function.returnType())
                .entryPointKind(kind)
                .build();
    }

    private CallReference unresolvedReference(FunctionRecord caller, CallExtraction call) {
        return CallReference.builder()
                .callerId(caller.id())
                .calleeName(call.calleeName())
                .receiver(call.receiver())
                .file(caller.file())
                .line(call.line())
                .column(call.column())
                .argumentCount(call.argumentCount())
                .build();
    }

    private static Optional<Span> innermost(List<Span> spans, int line) {
        return spans.stream()
                .filter(s -> line >= s.start() && line <= s.end())
                .min(Comparator.comparingInt((Span s) -> s.end() - s.start())
                        .thenComparing(Comparator.comparingInt(Span::start).reversed()));
    }

    private static AssembledGraph.ExtractionSummary summarize(List<FileExtraction> files) {
        int fallback = 0;
        int withErrors = 0;
        double confidence = 0.0;
        for (FileExtraction file : files) {
            if (file.quality() != null) {
                confidence += file.quality().confidence();
                if (file.quality().usedFallback()) {
                    fallback++;
                }
            }
            if (!file.errors().isEmpty()) {
                withErrors++;
            }
        }
        double average = files.isEmpty() ? 0.0 : confidence / files.size();
        return new AssembledGraph.ExtractionSummary(files.size(), fallback, withErrors, average);
    }

    private record Span(String id, int start, int end) {}
}
