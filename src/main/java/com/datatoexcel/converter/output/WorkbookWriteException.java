package com.datatoexcel.converter.output;

/**
 * Raised when tables cannot be rendered into a workbook or the workbook cannot be saved.
 */
public class WorkbookWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WorkbookWriteException(String message) {
        super(message);
    }

    public WorkbookWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
