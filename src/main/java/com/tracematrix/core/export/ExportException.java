package com.tracematrix.core.export;

/**
 * An audit artifact could not be rendered or written. Fatal for the invoking command.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
