package com.vidnyan.cga.scanner;

import com.vidnyan.cga.CgaProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scanSourceFiles_ShouldFindFilesOfEverySupportedLanguage() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner(new CgaProperties());

        Path mainJava = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(mainJava);
        Files.writeString(mainJava.resolve("Service.java"), "public class Service {}");
        Files.writeString(mainJava.resolve("readme.txt"), "documentation");

        Path app = tempDir.resolve("app");
        Files.createDirectories(app);
        Files.writeString(app.resolve("views.py"), "def index():\n    pass\n");
        Files.writeString(app.resolve("client.tsx"), "export const App = () => null;");
        Files.writeString(app.resolve("types.d.ts"), "export interface User {}");

        Files.writeString(tempDir.resolve("index.js"), "module.exports = {};");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(4, results.size());
        assertTrue(results.stream().anyMatch(p -> p.endsWith("Service.java")));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("views.py")));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("client.tsx")));
        assertTrue(results.stream().anyMatch(p -> p.endsWith("index.js")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("readme.txt")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("types.d.ts")));
    }

    @Test
    void scanSourceFiles_ShouldSkipDependencyAndStorageDirectories() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner(new CgaProperties());

        Path dependency = tempDir.resolve("node_modules/lodash");
        Files.createDirectories(dependency);
        Files.writeString(dependency.resolve("index.js"), "module.exports = {};");

        Path storage = tempDir.resolve(".cga/call-graph");
        Files.createDirectories(storage);
        Files.writeString(storage.resolve("cache.py"), "x = 1");

        Path source = tempDir.resolve("src");
        Files.createDirectories(source);
        Files.writeString(source.resolve("main.ts"), "export function main() {}");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(List.of(source.resolve("main.ts")), results);
    }

    @Test
    void scanSourceFiles_ShouldReturnSortedPaths() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner(new CgaProperties());
        Files.writeString(tempDir.resolve("b.py"), "");
        Files.writeString(tempDir.resolve("a.py"), "");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(List.of(tempDir.resolve("a.py"), tempDir.resolve("b.py")), results);
    }
}
