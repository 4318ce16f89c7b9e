package com.nayem.strata.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.strata.core.MutationApplier;
import com.nayem.strata.json.ObjectValueJson;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StrataProperties.class)
public class StrataAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StrataAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MutationApplier mutationApplier(StrataProperties properties,
            ObjectProvider<MeterRegistry> registryProvider) {

        MeterRegistry registry = null;
        if (properties.getMetrics().isEnabled()) {
            registry = registryProvider.getIfAvailable();
            if (registry == null) {
                log.warn("strata.metrics.enabled is set but no MeterRegistry bean is available; "
                        + "mutation metrics will not be recorded");
            }
        }

        return MutationApplier.builder()
                .metrics(registry)
                .metricsPrefix(properties.getMetrics().getPrefix())
                .serverTimestampBehavior(properties.getServerTimestampBehavior())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectValueJson objectValueJson(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return new ObjectValueJson(mapper);
    }
}
