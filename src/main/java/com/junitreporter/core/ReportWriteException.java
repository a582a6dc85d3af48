package com.junitreporter.core;

import java.nio.file.Path;

/**
 * The rendered report could not be written. Always propagated to the caller of run end:
 * a missing report must be distinguishable from one written successfully.
 */
public class ReportWriteException extends RuntimeException {

    private final Path outputPath;

    public ReportWriteException(Path outputPath, Throwable cause) {
        super("Failed to write JUnit XML report to " + outputPath + ": " + cause.getMessage(), cause);
        this.outputPath = outputPath;
    }

    public Path getOutputPath() {
        return outputPath;
    }
}
