package com.nayem.strata.spring;

import com.nayem.strata.model.value.ServerTimestampBehavior;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the strata mutation engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code strata} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "strata")
@Validated
public class StrataProperties {

    /**
     * How pending server timestamps read through
     * {@link com.nayem.strata.core.MutationApplier#readField}: none, estimate or previous.
     */
    @NotNull
    private ServerTimestampBehavior serverTimestampBehavior = ServerTimestampBehavior.NONE;

    /**
     * Configuration for Micrometer metrics.
     */
    @Valid
    private Metrics metrics = new Metrics();

    /** @return the default server timestamp behavior */
    public ServerTimestampBehavior getServerTimestampBehavior() {
        return serverTimestampBehavior;
    }

    /** @param serverTimestampBehavior the default server timestamp behavior */
    public void setServerTimestampBehavior(ServerTimestampBehavior serverTimestampBehavior) {
        this.serverTimestampBehavior = serverTimestampBehavior;
    }

    /** @return the metrics configuration */
    public Metrics getMetrics() {
        return metrics;
    }

    /** @param metrics the metrics configuration */
    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Metrics recorded per applied, skipped and failed mutation. Requires a
     * {@code MeterRegistry} bean; without one nothing is recorded.
     */
    public static class Metrics {
        /**
         * Whether mutation metrics are recorded.
         */
        private boolean enabled = true;

        /**
         * Prefix of every meter name.
         */
        @NotBlank
        private String prefix = "strata";

        /** @return whether metrics are enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether metrics are enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** @return the meter name prefix */
        public String getPrefix() {
            return prefix;
        }

        /** @param prefix the meter name prefix */
        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }
}
