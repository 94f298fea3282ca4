package com.transitgate.infrastructure.io;

/**
 * The dataset or one of its reference tables could not be loaded. Fatal; raised before any stage runs.
 */
public class DatasetLoadException extends RuntimeException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
