package com.datatoexcel.converter.naming;

/**
 * Raised when a naming registry resource cannot be read.
 */
public class NamingRegistryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NamingRegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public NamingRegistryException(String message) {
        super(message);
    }
}
