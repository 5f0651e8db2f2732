package com.vidnyan.cga.domain.extraction;

/**
 * Thrown by an extraction strategy that cannot make sense of a file.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
