package com.nayem.strata.util;

/**
 * Signals a broken internal invariant: a caller bug or corrupted data, never an
 * expected outcome of applying a mutation.
 * <p>
 * Callers should not catch this to recover. A precondition that does not hold is
 * reported by returning the input document unchanged, not by this exception.
 * </p>
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
