package com.nayem.strata.mutation;

/**
 * The closed set of mutation kinds. Switch on {@link Mutation#getType()} with a switch
 * expression so a new kind is a compile error at every consumer.
 */
public enum MutationType {
    SET,
    PATCH,
    TRANSFORM,
    DELETE
}
