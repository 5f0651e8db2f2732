package com.vidnyan.cga.application.service;

import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.domain.extraction.ExtractionException;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.ExtractionQuality;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the hybrid extractor over every source file on a fixed worker pool, one task per file.
 * Files are read before their task is submitted; workers only append their own result.
 * Returns once every file is done, sorted by path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionService {

    private final HybridExtractor hybridExtractor;
    private final CgaProperties properties;

    public List<FileExtraction> extractAll(Path projectRoot, List<Path> files) {
        ConcurrentLinkedQueue<FileExtraction> results = new ConcurrentLinkedQueue<>();
        List<String> taskFiles = new ArrayList<>();
        List<Callable<Void>> tasks = new ArrayList<>();

        for (Path path : files) {
            String relative = relativePath(projectRoot, path);
            Optional<Language> language = Language.forFileName(path.getFileName().toString());
            if (language.isEmpty()) {
                continue;
            }
            String source;
            try {
                source = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", relative, e.getMessage());
                List<String> errors = List.of("Cannot read file: " + e.getMessage());
                results.add(FileExtraction.failed(relative, language.get(), errors,
                        ExtractionQuality.failed(ExtractionMethod.REGEX, errors, 0)));
                continue;
            }
            taskFiles.add(relative);
            tasks.add(() -> {
                results.add(hybridExtractor.extract(source, relative, language.get()));
                return null;
            });
        }

        int threads = Math.max(1, Math.min(properties.getExtraction().getWorkerThreads(), Math.max(1, tasks.size())));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Void>> futures = pool.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    String file = taskFiles.get(i);
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Extraction of {} failed: {}", file, cause.getMessage());
                    List<String> errors = List.of("Extraction failed: " + cause.getMessage());
                    results.add(FileExtraction.failed(file,
                            Language.forFileName(file).orElse(Language.JAVA), errors,
                            ExtractionQuality.failed(ExtractionMethod.HYBRID, errors, 0)));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Extraction interrupted", e);
        } finally {
            pool.shutdownNow();
        }

        List<FileExtraction> ordered = results.stream()
                .sorted(Comparator.comparing(FileExtraction::file))
                .toList();
        long failed = ordered.stream().filter(FileExtraction::failedCompletely).count();
        log.info("Extracted {} files with {} threads ({} failed)", ordered.size(), threads, failed);
        return ordered;
    }

    static String relativePath(Path projectRoot, Path file) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : absolute;
        return relative.toString().replace('\\', '/');
    }
}
