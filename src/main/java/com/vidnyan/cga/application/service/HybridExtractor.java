package com.vidnyan.cga.application.service;

import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.application.port.out.DataAccessScanner;
import com.vidnyan.cga.application.port.out.ExtractionStrategy;
import com.vidnyan.cga.domain.extraction.ExtractionMerger;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.ExtractionQuality;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.Language;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-file extraction: structural parser first, regex fallback when the parser fails,
 * times out or finds nothing in a non-trivial file. Both results are merged deterministically.
 * A failing file degrades to fallback-only or to an explicit error result; nothing is thrown.
 * Structural parses run on a pool of {@code workerThreads} daemon threads; a parser that ignores
 * cancellation keeps its thread until it returns, and later parses queue behind it.
 */
@Slf4j
@Component
public class HybridExtractor implements AutoCloseable {

    private final ExtractionStrategyRegistry registry;
    private final DataAccessScanner dataAccessScanner;
    private final CgaProperties.Extraction settings;
    private final ThreadPoolExecutor parseExecutor;

    public HybridExtractor(ExtractionStrategyRegistry registry, DataAccessScanner dataAccessScanner,
                           CgaProperties properties) {
        this.registry = registry;
        this.dataAccessScanner = dataAccessScanner;
        this.settings = properties.getExtraction();
        int threads = Math.max(1, settings.getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        this.parseExecutor = new ThreadPoolExecutor(threads, threads, 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread thread = new Thread(r, "cga-parse-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        this.parseExecutor.allowCoreThreadTimeOut(true);
    }

    public int parseThreads() {
        return parseExecutor.getMaximumPoolSize();
    }

    public FileExtraction extract(String source, String file, Language language) {
        long start = System.nanoTime();
        Optional<ExtractionStrategy> primary = settings.isEnableStructural()
                ? registry.primary(language) : Optional.empty();
        Optional<ExtractionStrategy> fallback = settings.isEnableRegexFallback()
                ? registry.fallback(language) : Optional.empty();

        FileExtraction result;
        if (primary.isEmpty()) {
            result = fallback.map(f -> fallbackOnly(f, source, file, language, start))
                    .orElseGet(() -> noStrategy(file, language, start));
        } else {
            result = hybrid(primary.get(), fallback, source, file, language, start);
        }
        return attachDataAccess(result, source, language);
    }

    private FileExtraction hybrid(ExtractionStrategy primary, Optional<ExtractionStrategy> fallback,
                                  String source, String file, Language language, long start) {
        FileExtraction primaryResult = null;
        String failure = null;
        try {
            primaryResult = runWithTimeout(primary, source, file);
        } catch (TimeoutException e) {
            failure = "Structural parse timed out after " + settings.getParseTimeoutMs() + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failure = "Structural parse failed: " + cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Structural parse interrupted";
        }

        if (primaryResult != null && !poorCoverage(primaryResult, source)) {
            log.debug("{}: {} functions, {} calls (structural)", file,
                    primaryResult.functions().size(), primaryResult.calls().size());
            return primaryResult.withQuality(primaryResult.quality().withExtractionTime(elapsedMs(start)));
        }

        String reason = failure != null ? failure : "Structural parse found no functions or declarations";
        if (fallback.isEmpty()) {
            if (primaryResult != null) {
                return primaryResult.withQuality(primaryResult.quality().withWarning(reason));
            }
            return failed(file, language, List.of(reason), ExtractionMethod.STRUCTURAL, start);
        }

        FileExtraction fallbackResult;
        try {
            fallbackResult = fallback.get().extract(source, file);
        } catch (RuntimeException e) {
            log.warn("{}: fallback extraction failed: {}", file, e.getMessage());
            if (primaryResult != null) {
                return primaryResult.withQuality(primaryResult.quality().withWarning(reason));
            }
            return failed(file, language, List.of(reason, "Regex extraction failed: " + e.getMessage()),
                    ExtractionMethod.HYBRID, start);
        }

        if (primaryResult == null) {
            log.warn("{}: {}; using regex fallback", file, reason);
            List<String> errors = new ArrayList<>(fallbackResult.errors());
            errors.add(0, reason);
            ExtractionQuality quality = fallbackResult.quality()
                    .withWarning(reason)
                    .withParseErrors(fallbackResult.quality().parseErrors() + 1)
                    .withFallbackUsed(elapsedMs(start));
            return fallbackResult.withErrors(errors, quality);
        }

        log.debug("{}: {}; merging regex fallback", file, reason);
        FileExtraction merged = ExtractionMerger.merge(primaryResult, fallbackResult);
        return merged.withQuality(merged.quality().withWarning(reason));
    }

    private FileExtraction fallbackOnly(ExtractionStrategy strategy, String source, String file,
                                        Language language, long start) {
        try {
            FileExtraction result = strategy.extract(source, file);
            log.debug("{}: {} functions, {} calls (regex)", file, result.functions().size(), result.calls().size());
            return result;
        } catch (RuntimeException e) {
            log.warn("{}: regex extraction failed: {}", file, e.getMessage());
            return failed(file, language, List.of("Regex extraction failed: " + e.getMessage()),
                    ExtractionMethod.REGEX, start);
        }
    }

    private FileExtraction noStrategy(String file, Language language, long start) {
        log.warn("{}: no extraction strategy registered for {}", file, language.tag());
        return failed(file, language, List.of("No extraction strategy for " + language.tag()),
                ExtractionMethod.REGEX, start);
    }

    private FileExtraction runWithTimeout(ExtractionStrategy strategy, String source, String file)
            throws TimeoutException, ExecutionException, InterruptedException {
        long timeoutMs = settings.getParseTimeoutMs();
        Future<FileExtraction> future = parseExecutor.submit(() -> {
            long started = System.nanoTime();
            try {
                return strategy.extract(source, file);
            } finally {
                long took = elapsedMs(started);
                if (took > timeoutMs) {
                    log.warn("{}: structural parse kept running {}ms past its {}ms timeout", file,
                            took - timeoutMs, timeoutMs);
                }
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (parseExecutor.getActiveCount() >= parseExecutor.getMaximumPoolSize()) {
                log.warn("{}: parse timed out with all {} parse threads busy; {} parse(s) queued", file,
                        parseExecutor.getMaximumPoolSize(), parseExecutor.getQueue().size());
            }
            throw e;
        }
    }

    private boolean poorCoverage(FileExtraction result, String source) {
        if (!result.functions().isEmpty() || !result.declarations().isEmpty()) {
            return false;
        }
        long nonBlank = source.lines().filter(l -> !l.isBlank()).count();
        return nonBlank >= settings.getPoorCoverageMinLines();
    }

    private FileExtraction attachDataAccess(FileExtraction result, String source, Language language) {
        try {
            List<DataAccessFact> facts = dataAccessScanner.scan(source, result.file(), language);
            if (facts.isEmpty()) {
                return result;
            }
            List<DataAccessFact> all = new ArrayList<>(result.dataAccess());
            all.addAll(facts);
            return result.withDataAccess(all);
        } catch (RuntimeException e) {
            log.warn("{}: data access scan failed: {}", result.file(), e.getMessage());
            List<String> errors = new ArrayList<>(result.errors());
            errors.add("Data access scan failed: " + e.getMessage());
            return result.withErrors(errors, result.quality());
        }
    }

    private static FileExtraction failed(String file, Language language, List<String> errors,
                                         ExtractionMethod method, long start) {
        return FileExtraction.failed(file, language, errors,
                ExtractionQuality.failed(method, errors, elapsedMs(start)));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @PreDestroy
    @Override
    public void close() {
        parseExecutor.shutdownNow();
    }
}
