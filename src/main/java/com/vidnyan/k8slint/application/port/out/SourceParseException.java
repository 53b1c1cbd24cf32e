package com.vidnyan.k8slint.application.port.out;

import lombok.Getter;

/**
 * A file could not be read or is not syntactically valid Go.
 */
@Getter
public class SourceParseException extends Exception {

    private final String path;
    private final int line;
    private final int column;

    public SourceParseException(String path, int line, int column, String message) {
        super(path + ":" + line + ":" + column + ": " + message);
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public SourceParseException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
        this.line = 0;
        this.column = 0;
    }
}
