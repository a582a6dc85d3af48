package com.junitreporter.classify;

/**
 * Signals that a test case reached the classifier with a status the reporter does
 * not recognize.
 *
 * This is a defect in the runner's contract. It is surfaced to the caller instead
 * of being mapped to a default category, since reporting an unknown outcome as a
 * pass would corrupt the CI signal.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }
}
