package com.nayem.strata.core;

import com.nayem.strata.model.Document;
import com.nayem.strata.model.FieldPath;
import com.nayem.strata.model.MaybeDocument;
import com.nayem.strata.model.Timestamp;
import com.nayem.strata.model.value.ServerTimestampBehavior;
import com.nayem.strata.mutation.Mutation;
import com.nayem.strata.mutation.MutationResult;
import com.nayem.strata.util.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point a mutation queue uses to compute document states.
 * <p>
 * Applies one {@link Mutation} at a time, either optimistically to the local view or
 * authoritatively after the backend acknowledged it, and records the outcome. The
 * applier holds no mutable state and may be shared between threads; ordering the
 * mutations of a document is the caller's job.
 * </p>
 * <p>
 * A mutation whose precondition does not hold returns the input document unchanged
 * and is counted as skipped. An {@link InvariantViolationException} is logged, counted
 * and rethrown.
 * </p>
 */
public class MutationApplier {

    private static final Logger log = LoggerFactory.getLogger(MutationApplier.class);

    private final MutationMetrics metrics;
    private final Clock clock;
    private final ServerTimestampBehavior serverTimestampBehavior;

    public MutationApplier(MutationMetrics metrics, Clock clock, ServerTimestampBehavior serverTimestampBehavior) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.serverTimestampBehavior = Objects.requireNonNull(serverTimestampBehavior, "serverTimestampBehavior");
    }

    public MutationApplier() {
        this(new MutationMetrics(null), Clock.systemUTC(), ServerTimestampBehavior.NONE);
    }

    /**
     * Computes the optimistic local view of {@code maybeDoc} after {@code mutation}.
     *
     * @param maybeDoc       the current local view, or null if nothing is known
     * @param baseDoc        the document before the mutation's batch, or null
     * @param localWriteTime the local time of the batch
     * @return the new view; the very same {@code maybeDoc} instance if the
     *         precondition did not hold
     */
    public MaybeDocument applyToLocalView(Mutation mutation, MaybeDocument maybeDoc, MaybeDocument baseDoc,
            Timestamp localWriteTime) {
        return apply(mutation, MutationMetrics.Path.LOCAL, maybeDoc,
                () -> mutation.applyToLocalView(maybeDoc, baseDoc, localWriteTime));
    }

    /**
     * Same as {@link #applyToLocalView(Mutation, MaybeDocument, MaybeDocument, Timestamp)}
     * with the write stamped at the current time of this applier's clock.
     */
    public MaybeDocument applyToLocalView(Mutation mutation, MaybeDocument maybeDoc, MaybeDocument baseDoc) {
        return applyToLocalView(mutation, maybeDoc, baseDoc, Timestamp.ofInstant(clock.instant()));
    }

    /**
     * Computes the remote document after the backend acknowledged {@code mutation}.
     *
     * @param maybeDoc the last known remote document, or null if nothing is known
     * @param result   the backend's acknowledgement
     */
    public MaybeDocument applyToRemoteDocument(Mutation mutation, MaybeDocument maybeDoc, MutationResult result) {
        Objects.requireNonNull(result, "result");
        return apply(mutation, MutationMetrics.Path.REMOTE, maybeDoc,
                () -> mutation.applyToRemoteDocument(maybeDoc, result));
    }

    /**
     * Reads the plain value at {@code path}, resolving pending server timestamps with
     * the configured default behavior.
     */
    public Object readField(Document document, FieldPath path) {
        return readField(document, path, serverTimestampBehavior);
    }

    public Object readField(Document document, FieldPath path, ServerTimestampBehavior behavior) {
        return document.getFieldValue(path, behavior);
    }

    public ServerTimestampBehavior getServerTimestampBehavior() {
        return serverTimestampBehavior;
    }

    private MaybeDocument apply(Mutation mutation, MutationMetrics.Path path, MaybeDocument maybeDoc,
            Supplier<MaybeDocument> application) {
        Objects.requireNonNull(mutation, "mutation");
        MaybeDocument result;
        try {
            result = application.get();
        } catch (InvariantViolationException e) {
            log.error("Invariant violated applying {} mutation to '{}' on the {} path: {}",
                    mutation.getType(), mutation.getKey(), MutationMetrics.tagValue(path), e.getMessage());
            metrics.recordFault(mutation.getType());
            throw e;
        }

        // Only a failed precondition hands back the input instance.
        if (result == maybeDoc) {
            log.debug("Skipped {} mutation to '{}' on the {} path: precondition {} not met by {}",
                    mutation.getType(), mutation.getKey(), MutationMetrics.tagValue(path),
                    mutation.getPrecondition(), maybeDoc);
            metrics.recordSkipped(mutation.getType(), path);
        } else {
            log.debug("Applied {} mutation to '{}' on the {} path", mutation.getType(), mutation.getKey(),
                    MutationMetrics.tagValue(path));
            metrics.recordApplied(mutation.getType(), path);
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a {@link MutationApplier}. Every setting is optional.
     */
    public static class Builder {
        private io.micrometer.core.instrument.MeterRegistry registry;
        private String metricsPrefix = MutationMetrics.DEFAULT_PREFIX;
        private Clock clock = Clock.systemUTC();
        private ServerTimestampBehavior serverTimestampBehavior = ServerTimestampBehavior.NONE;

        /**
         * Sets the Micrometer registry for recording metrics. Without one, nothing is
         * recorded.
         *
         * @param registry The Micrometer registry.
         * @return this builder
         */
        public Builder metrics(io.micrometer.core.instrument.MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the prefix of every meter name. Default is "strata".
         *
         * @param prefix The meter name prefix.
         * @return this builder
         */
        public Builder metricsPrefix(String prefix) {
            this.metricsPrefix = prefix;
            return this;
        }

        /**
         * Sets the clock that stamps local writes when no write time is given.
         * Default is the system UTC clock.
         *
         * @param clock The clock.
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets how {@link MutationApplier#readField(Document, FieldPath)} resolves
         * pending server timestamps. Default is {@link ServerTimestampBehavior#NONE}.
         *
         * @param behavior The default behavior.
         * @return this builder
         */
        public Builder serverTimestampBehavior(ServerTimestampBehavior behavior) {
            this.serverTimestampBehavior = behavior;
            return this;
        }

        /**
         * Builds and returns a configured {@link MutationApplier}.
         *
         * @return The new applier.
         * @throws IllegalStateException if the metrics prefix is blank.
         */
        public MutationApplier build() {
            if (metricsPrefix == null || metricsPrefix.isBlank()) {
                throw new IllegalStateException("Metrics prefix must not be blank.");
            }
            return new MutationApplier(new MutationMetrics(registry, metricsPrefix), clock, serverTimestampBehavior);
        }
    }
}
