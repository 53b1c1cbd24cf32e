package com.vidnyan.k8slint.adapter.out.scanner;

import com.vidnyan.k8slint.application.port.out.SourceFileLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds Go source files, skipping Go test files.
 */
@Slf4j
@Component
public class GoSourceScanner implements SourceFileLocator {

    private static final String GO_SUFFIX = ".go";
    private static final String TEST_SUFFIX = "_test.go";

    @Override
    public List<Path> locate(Path root) throws IOException {
        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString(), null, "source path does not exist");
        }
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> files = paths.filter(Files::isRegularFile)
                    .filter(GoSourceScanner::isLintable)
                    .sorted()
                    .toList();
            log.debug("Found {} Go files under {}", files.size(), root);
            return files;
        }
    }

    static boolean isLintable(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(GO_SUFFIX) && !name.endsWith(TEST_SUFFIX);
    }
}
