package com.questrail.meshinfo.persistence;

/**
 * A unit of work could not be completed. Nothing it did was committed.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
