package com.junitreporter.model;

/**
 * Thrown when a result tree violates its structure badly enough that no sensible
 * report can be produced, e.g. a suite node without a recognized kind.
 *
 * Missing optional fields (identifier, labels, messages) are not structural
 * violations; the renderer substitutes defaults for those.
 */
public class MalformedResultTreeException extends RuntimeException {

    public MalformedResultTreeException(String message) {
        super(message);
    }

    public MalformedResultTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
