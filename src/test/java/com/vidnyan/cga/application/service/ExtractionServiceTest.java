package com.vidnyan.cga.application.service;

import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.adapter.out.dataaccess.PatternDataAccessScanner;
import com.vidnyan.cga.adapter.out.parser.JavaParserExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.JavaRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.PythonRegexExtractionStrategy;
import com.vidnyan.cga.adapter.out.parser.regex.TypeScriptRegexExtractionStrategy;
import com.vidnyan.cga.domain.extraction.ExtractionMethod;
import com.vidnyan.cga.domain.extraction.FileExtraction;
import com.vidnyan.cga.domain.model.Language;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionServiceTest {

    @TempDir
    Path tempDir;

    private HybridExtractor hybridExtractor;
    private ExtractionService service;

    @BeforeEach
    void setUp() {
        CgaProperties properties = new CgaProperties();
        ExtractionStrategyRegistry registry = ExtractionStrategyRegistry.builder()
                .register(new JavaParserExtractionStrategy())
                .register(new JavaRegexExtractionStrategy())
                .register(new PythonRegexExtractionStrategy())
                .register(new TypeScriptRegexExtractionStrategy(Language.TYPESCRIPT))
                .build();
        hybridExtractor = new HybridExtractor(registry, new PatternDataAccessScanner(), properties);
        service = new ExtractionService(hybridExtractor, properties);
    }

    @AfterEach
    void tearDown() {
        hybridExtractor.close();
    }

    @Test
    void extractAll_ShouldReturnOneResultPerFileSortedByRelativePath() throws IOException {
        // Arrange
        Path java = tempDir.resolve("src/App.java");
        Path python = tempDir.resolve("app/jobs.py");
        Path script = tempDir.resolve("web/index.ts");
        Files.createDirectories(java.getParent());
        Files.createDirectories(python.getParent());
        Files.createDirectories(script.getParent());
        Files.writeString(java, "public class App {\n    public static void main(String[] args) {\n    }\n}\n");
        Files.writeString(python, "def purge():\n    cursor.execute(\"DELETE FROM sessions\")\n");
        Files.writeString(script, "export function start() {\n  return 1;\n}\n");

        // Act
        List<FileExtraction> results = service.extractAll(tempDir, List.of(script, java, python));

        // Assert
        assertEquals(List.of("app/jobs.py", "src/App.java", "web/index.ts"),
                results.stream().map(FileExtraction::file).toList());
        assertEquals(ExtractionMethod.REGEX, results.get(0).quality().method());
        assertEquals(1, results.get(0).dataAccess().size());
        assertEquals(ExtractionMethod.STRUCTURAL, results.get(1).quality().method());
        assertEquals("start", results.get(2).functions().get(0).name());
    }

    @Test
    void extractAll_ShouldSkipUnsupportedFilesAndReportUnreadableOnes() throws IOException {
        // Arrange
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, "hello");
        Path missing = tempDir.resolve("gone.py");

        // Act
        List<FileExtraction> results = service.extractAll(tempDir, List.of(notes, missing));

        // Assert
        assertEquals(1, results.size());
        assertEquals("gone.py", results.get(0).file());
        assertTrue(results.get(0).failedCompletely());
        assertTrue(results.get(0).errors().get(0).startsWith("Cannot read file"));
    }

    @Test
    void extractAll_ShouldHandleNoFiles() {
        assertTrue(service.extractAll(tempDir, List.of()).isEmpty());
    }

    @Test
    void relativePath_ShouldUseForwardSlashesUnderRoot() {
        assertEquals("src/main/App.java",
                ExtractionService.relativePath(tempDir, tempDir.resolve("src").resolve("main").resolve("App.java")));
    }
}
