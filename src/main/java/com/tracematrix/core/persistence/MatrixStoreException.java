package com.tracematrix.core.persistence;

/**
 * The matrix file could not be written. Fatal for the invoking command.
 */
public class MatrixStoreException extends RuntimeException {

    public MatrixStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
