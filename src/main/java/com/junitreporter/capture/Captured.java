package com.junitreporter.capture;

/**
 * The value of one test execution plus the text it wrote while running.
 * {@code stdout} and {@code stderr} are never null.
 */
public record Captured<T>(T value, String stdout, String stderr) {

    public Captured {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static <T> Captured<T> uncaptured(T value) {
        return new Captured<>(value, "", "");
    }
}
