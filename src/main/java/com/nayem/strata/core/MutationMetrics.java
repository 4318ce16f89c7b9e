package com.nayem.strata.core;

import com.nayem.strata.mutation.MutationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer counters for mutation application. Every method is a no-op when no
 * registry was supplied.
 */
public class MutationMetrics {

    public static final String DEFAULT_PREFIX = "strata";

    /** Which code path a mutation was applied on. */
    public enum Path {
        LOCAL,
        REMOTE
    }

    private final Map<MutationType, Map<Path, Counter>> appliedCounters;
    private final Map<MutationType, Map<Path, Counter>> skippedCounters;
    private final Map<MutationType, Counter> faultCounters;

    public MutationMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public MutationMetrics(MeterRegistry registry, String prefix) {
        this.appliedCounters = new EnumMap<>(MutationType.class);
        this.skippedCounters = new EnumMap<>(MutationType.class);
        this.faultCounters = new EnumMap<>(MutationType.class);

        if (registry != null) {
            for (MutationType type : MutationType.values()) {
                Map<Path, Counter> applied = new EnumMap<>(Path.class);
                Map<Path, Counter> skipped = new EnumMap<>(Path.class);
                for (Path path : Path.values()) {
                    applied.put(path, Counter.builder(prefix + ".mutations.applied")
                            .description("Mutations that changed the document they were applied to")
                            .tag("type", tagValue(type))
                            .tag("path", tagValue(path))
                            .register(registry));
                    skipped.put(path, Counter.builder(prefix + ".mutations.skipped")
                            .description("Mutations left as no-ops because their precondition did not hold")
                            .tag("type", tagValue(type))
                            .tag("path", tagValue(path))
                            .register(registry));
                }
                appliedCounters.put(type, applied);
                skippedCounters.put(type, skipped);

                faultCounters.put(type, Counter.builder(prefix + ".mutations.faults")
                        .description("Invariant violations raised while applying mutations")
                        .tag("type", tagValue(type))
                        .register(registry));
            }
        }
    }

    public void recordApplied(MutationType type, Path path) {
        Map<Path, Counter> counters = appliedCounters.get(type);
        if (counters != null) {
            counters.get(path).increment();
        }
    }

    public void recordSkipped(MutationType type, Path path) {
        Map<Path, Counter> counters = skippedCounters.get(type);
        if (counters != null) {
            counters.get(path).increment();
        }
    }

    public void recordFault(MutationType type) {
        Counter counter = faultCounters.get(type);
        if (counter != null) {
            counter.increment();
        }
    }

    static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
