package com.junitreporter.classify;

import com.junitreporter.model.Fault;

import java.util.Arrays;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Ready-made predicates that decide whether a {@link Fault} came from assertion
 * machinery (rendered as {@code <failure>}) or is an unexpected error
 * (rendered as {@code <error>}).
 *
 * Which fault shapes count as "expected" failures is a policy of the adopting
 * runner, so the classifier takes any {@code Predicate<Fault>}.
 */
public final class AssertionFaults {

    /** Type name used for assertion failures that carry no fault object. */
    public static final String EXPECTATION_FAILED = "ExpectationFailed";

    private static final String[] ASSERTION_SUFFIXES = {
        "AssertionError",          // java.lang, TestNG soft asserts
        "AssertionFailedError",    // org.opentest4j, junit.framework
        "ComparisonFailure"        // org.junit
    };

    private AssertionFaults() {}

    /**
     * Recognizes {@code ExpectationFailed} (simple or qualified) and the usual JVM
     * assertion error family by simple type name suffix.
     */
    public static Predicate<Fault> defaults() {
        return fault -> {
            if (fault == null || !fault.hasTypeName()) return false;
            String simple = fault.getSimpleTypeName();
            if (EXPECTATION_FAILED.equals(simple)) return true;
            for (String suffix : ASSERTION_SUFFIXES) {
                if (simple.endsWith(suffix)) return true;
            }
            return false;
        };
    }

    /**
     * Recognizes exactly the given type names. A name matches a fault when it equals
     * either the fault's full type name or its simple name.
     */
    public static Predicate<Fault> ofTypeNames(String... typeNames) {
        Set<String> names = Arrays.stream(typeNames).collect(Collectors.toUnmodifiableSet());
        return fault -> fault != null && fault.hasTypeName()
            && (names.contains(fault.getTypeName()) || names.contains(fault.getSimpleTypeName()));
    }
}
