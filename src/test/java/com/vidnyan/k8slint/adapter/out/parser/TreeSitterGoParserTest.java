package com.vidnyan.k8slint.adapter.out.parser;

import com.vidnyan.k8slint.application.port.out.SourceParseException;
import com.vidnyan.k8slint.domain.ast.AstWalker;
import com.vidnyan.k8slint.domain.ast.CompositeLit;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import com.vidnyan.k8slint.domain.ast.TopLevelVar;
import com.vidnyan.k8slint.domain.match.Matchers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterGoParserTest {

    private final TreeSitterGoParser parser = new TreeSitterGoParser();

    @TempDir
    Path tempDir;

    @Test
    void parse_ShouldExposePackageAndTopLevelVars() throws SourceParseException {
        // Arrange
        String source = """
                package manifests

                import corev1 "k8s.io/api/core/v1"

                var (
                    Web = corev1.Container{Name: "web"}
                    _   = corev1.Container{}
                )

                var Sidecar, Proxy = &corev1.Container{Name: "a"}, corev1.Container{Name: "b"}

                const Namespace = "shop"
                """;

        // Act
        SourceFile file = parser.parse("manifests.go", source);

        // Assert
        assertEquals("manifests", file.packageName());
        List<String> names = file.topLevelVars().stream().map(TopLevelVar::nameText).toList();
        assertEquals(List.of("Web", "Sidecar", "Proxy"), names);
        assertTrue(file.topLevelNames().contains("Namespace"));
        assertEquals("Container", Matchers.typeNameOf(file.topLevelVars().get(1).value()).orElseThrow());
    }

    @Test
    void parse_ShouldGiveElidedLiteralsTheElementTypeOfTheirSlice() throws SourceParseException {
        String source = """
                package manifests

                var Pod = corev1.PodSpec{
                    Containers: []corev1.Container{
                        {Name: "web", Env: []corev1.EnvVar{{Name: "MODE", Value: "prod"}}},
                    },
                    Volumes: []*corev1.Volume{{Name: "data"}},
                }
                """;

        SourceFile file = parser.parse("manifests.go", source);

        List<String> types = AstWalker.compositeLiterals(file).stream()
                .map(literal -> Matchers.typeNameOf(literal).orElse("?"))
                .toList();
        assertEquals(List.of("PodSpec", "?", "Container", "?", "EnvVar", "?", "Volume"), types);
        CompositeLit volume = AstWalker.compositeLiterals(file).get(6);
        assertNull(volume.type());
        assertTrue(volume.impliedPointer());
    }

    @Test
    void parse_ShouldReportOneBasedLineAndByteColumn() throws SourceParseException {
        String source = "package manifests\n\n// é\nvar Web = corev1.Container{Name: \"é\", Image: \"nginx\"}\n";

        SourceFile file = parser.parse("manifests.go", source);

        CompositeLit container = AstWalker.compositeLiterals(file).get(0);
        assertEquals(4, container.span().line());
        assertEquals(11, container.span().column());
        var image = Matchers.field(container, "Image").orElseThrow();
        // "é" is two bytes wide
        assertEquals(40, image.span().column());
        assertEquals("Image: \"nginx\"", file.text(image.span()));
    }

    @Test
    void parse_ShouldRejectSyntaxErrorsWithPosition() {
        String source = """
                package manifests

                var Web = corev1.Container{Name: "web",,}
                """;

        SourceParseException error = assertThrows(SourceParseException.class,
                () -> parser.parse("broken.go", source));

        assertEquals("broken.go", error.getPath());
        assertEquals(3, error.getLine());
    }

    @Test
    void parse_ShouldReadFilesFromDisk() throws IOException, SourceParseException {
        Path file = tempDir.resolve("web.go");
        Files.writeString(file, "package web\n\nvar Web = corev1.Container{Name: \"web\"}\n");

        SourceFile parsed = parser.parse(file);

        assertEquals(file.toString(), parsed.path());
        assertEquals(1, parsed.topLevelVars().size());
    }

    @Test
    void parse_ShouldFailForMissingFile() {
        assertThrows(SourceParseException.class, () -> parser.parse(tempDir.resolve("missing.go")));
    }
}
