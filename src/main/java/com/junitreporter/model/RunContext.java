package com.junitreporter.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Run-scoped metadata captured once at run begin and shared by every
 * {@code <testsuite>} of that run.
 *
 * A new instance is created for each run; nothing here outlives the run it describes.
 */
public final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    public static final String FALLBACK_HOSTNAME = "localhost";
    private static final DateTimeFormatter ISO_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final LocalDateTime startedAt;
    private final String hostname;

    private RunContext(LocalDateTime startedAt, String hostname) {
        this.startedAt = startedAt;
        this.hostname  = (hostname == null || hostname.isBlank()) ? FALLBACK_HOSTNAME : hostname;
    }

    /** Captures the current local time and resolves the hostname. */
    public static RunContext start() {
        return new RunContext(LocalDateTime.now(), resolveHostname());
    }

    public static RunContext of(LocalDateTime startedAt, String hostname) {
        if (startedAt == null) throw new IllegalArgumentException("startedAt is required");
        return new RunContext(startedAt, hostname);
    }

    public LocalDateTime getStartedAt() { return startedAt; }
    public String        getHostname()  { return hostname; }

    /** ISO-8601 local date-time at second precision, e.g. {@code 2026-02-14T13:30:00}. */
    public String getTimestamp() {
        return startedAt.format(ISO_SECONDS);
    }

    /** Best-effort local hostname; {@value #FALLBACK_HOSTNAME} on any resolution failure. */
    static String resolveHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("RunContext: Could not resolve hostname, using {}: {}", FALLBACK_HOSTNAME, e.getMessage());
            return FALLBACK_HOSTNAME;
        }
    }
}
