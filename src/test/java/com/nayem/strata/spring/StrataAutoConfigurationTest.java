package com.nayem.strata.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.strata.core.MutationApplier;
import com.nayem.strata.json.ObjectValueJson;
import com.nayem.strata.model.value.ServerTimestampBehavior;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static com.nayem.strata.testutil.TestUtil.map;
import static com.nayem.strata.testutil.TestUtil.setMutation;
import static org.assertj.core.api.Assertions.assertThat;

class StrataAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StrataAutoConfiguration.class));

    @Test
    void shouldRegisterDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(MutationApplier.class);
            assertThat(context).hasSingleBean(ObjectValueJson.class);
            assertThat(context.getBean(MutationApplier.class).getServerTimestampBehavior())
                    .isEqualTo(ServerTimestampBehavior.NONE);
        });
    }

    @Test
    void shouldBindServerTimestampBehavior() {
        contextRunner.withPropertyValues("strata.server-timestamp-behavior=estimate")
                .run(context -> assertThat(context.getBean(MutationApplier.class).getServerTimestampBehavior())
                        .isEqualTo(ServerTimestampBehavior.ESTIMATE));
    }

    @Test
    void shouldRecordMetricsIntoRegistryBean() {
        contextRunner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("strata.metrics.prefix=docs")
                .run(context -> {
                    context.getBean(MutationApplier.class)
                            .applyToLocalView(setMutation("users/alice", map("a", 1L)), null, null);

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get("docs.mutations.applied")
                            .tag("type", "set").tag("path", "local").counter().count()).isEqualTo(1.0);
                });
    }

    @Test
    void shouldSkipMetricsWhenDisabled() {
        contextRunner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("strata.metrics.enabled=false")
                .run(context -> {
                    context.getBean(MutationApplier.class)
                            .applyToLocalView(setMutation("users/alice", map()), null, null);

                    assertThat(context.getBean(MeterRegistry.class).find("strata.mutations.applied").counter())
                            .isNull();
                });
    }

    @Test
    void shouldBackOffForUserBeans() {
        MutationApplier custom = new MutationApplier();
        contextRunner.withBean(MutationApplier.class, () -> custom)
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .run(context -> {
                    assertThat(context.getBean(MutationApplier.class)).isSameAs(custom);
                    assertThat(context).hasSingleBean(ObjectValueJson.class);
                });
    }
}
