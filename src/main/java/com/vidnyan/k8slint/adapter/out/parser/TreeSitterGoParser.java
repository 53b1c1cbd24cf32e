package com.vidnyan.k8slint.adapter.out.parser;

import com.vidnyan.k8slint.application.port.out.SourceParseException;
import com.vidnyan.k8slint.application.port.out.SourceParser;
import com.vidnyan.k8slint.domain.ast.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses Go files with tree-sitter and converts the concrete syntax tree into the
 * linter's own tree. A tree containing any error node is rejected as a whole.
 */
@Slf4j
@Component
public class TreeSitterGoParser implements SourceParser {

    // TSParser is not thread-safe; files are parsed concurrently
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterGo())) {
            throw new IllegalStateException("Could not load the tree-sitter Go grammar");
        }
        return parser;
    });

    @Override
    public SourceFile parse(Path file) throws SourceParseException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException(file.toString(), "cannot read file", e);
        }
        return parse(file.toString(), content);
    }

    @Override
    public SourceFile parse(String path, String content) throws SourceParseException {
        log.debug("Parsing {}", path);
        TSTree tree = PARSER.get().parseString(null, content);
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new SourceParseException(path, 1, 1, "parser produced no tree");
        }
        if (root.hasError()) {
            TSNode error = firstError(root);
            TSNode at = error != null ? error : root;
            throw new SourceParseException(path,
                    at.getStartPoint().getRow() + 1,
                    at.getStartPoint().getColumn() + 1,
                    error != null ? "syntax error" : "missing token");
        }
        return new GoTreeConverter(path, content).convert(root);
    }

    private static TSNode firstError(TSNode node) {
        if ("ERROR".equals(node.getType())) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode found = firstError(node.getChild(i));
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
