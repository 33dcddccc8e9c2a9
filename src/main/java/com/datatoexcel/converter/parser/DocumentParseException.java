package com.datatoexcel.converter.parser;

/**
 * Raised when a source document cannot be read or is not a well-formed object document.
 */
public class DocumentParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
