package com.junitreporter.render;

/**
 * A rendered JUnit XML document together with its whole-run totals.
 */
public record RenderedReport(String xml, ReportTotals totals) {}
