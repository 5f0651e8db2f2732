package com.vidnyan.cga.scanner;

import com.vidnyan.cga.CgaProperties;
import com.vidnyan.cga.domain.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans a repository for source files of every supported language.
 * Excluded directories (dependencies, build output, the graph store) are never entered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryScanner {

    private final CgaProperties properties;

    /**
     * Scan and return all source files under the root, sorted by path.
     */
    public List<Path> scanSourceFiles(Path repositoryRoot) throws IOException {
        Set<String> excluded = new HashSet<>(properties.getExtraction().getExcludeDirectories());
        excluded.add(properties.getStorage().getDirectory());
        List<Path> sourceFiles = new ArrayList<>();

        Files.walkFileTree(repositoryRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(repositoryRoot) && excluded.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && Language.forFileName(file.getFileName().toString()).isPresent()) {
                    sourceFiles.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        sourceFiles.sort(null);
        log.debug("Found {} source files under {}", sourceFiles.size(), repositoryRoot);
        return sourceFiles;
    }
}
