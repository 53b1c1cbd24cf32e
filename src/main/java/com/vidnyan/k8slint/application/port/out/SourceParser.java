package com.vidnyan.k8slint.application.port.out;

import com.vidnyan.k8slint.domain.ast.SourceFile;

import java.nio.file.Path;

/**
 * Output port for turning Go source into a tree.
 * Every call returns a fresh tree owned by the caller.
 */
public interface SourceParser {

    SourceFile parse(Path file) throws SourceParseException;

    /**
     * @param path name reported in issues for this content
     */
    SourceFile parse(String path, String content) throws SourceParseException;
}
