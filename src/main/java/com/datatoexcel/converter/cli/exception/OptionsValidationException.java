package com.datatoexcel.converter.cli.exception;

import java.util.List;

/**
 * Thrown when the convert options are unusable. Carries every problem found, not only the first,
 * so that all of them can be reported in one run.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s):" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
