package com.nayem.strata.util;

/**
 * Hard assertions that stay on in production.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * Throws {@link InvariantViolationException} with the formatted message if
     * {@code condition} is false.
     */
    public static void hardAssert(boolean condition, String messageFormat, Object... args) {
        if (!condition) {
            throw fail(messageFormat, args);
        }
    }

    /**
     * Throws the fault for an unreachable or unsupported case. Call sites write
     * {@code throw Assert.fail(...)}.
     */
    public static InvariantViolationException fail(String messageFormat, Object... args) {
        throw new InvariantViolationException("INTERNAL ASSERTION FAILED: " + String.format(messageFormat, args));
    }
}
