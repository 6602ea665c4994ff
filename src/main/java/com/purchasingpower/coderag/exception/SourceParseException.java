package com.purchasingpower.coderag.exception;

import lombok.Getter;

/**
 * The chunker could not build an outline for a file.
 *
 * <p>Never reaches callers of the chunker: the file is re-chunked with fixed line windows.
 */
@Getter
public class SourceParseException extends RuntimeException {

    private final String filePath;
    private final int line;

    public SourceParseException(String filePath, int line, String message) {
        super(message + " (" + filePath + ":" + line + ")");
        this.filePath = filePath;
        this.line = line;
    }

    public SourceParseException(String filePath, String message, Throwable cause) {
        super(message + " (" + filePath + ")", cause);
        this.filePath = filePath;
        this.line = 0;
    }
}
