package com.tracematrix.core.config;

import com.tracematrix.core.vcs.GitCliGateway;
import com.tracematrix.core.vcs.VersionControlGateway;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TraceabilityConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TraceabilityConfiguration.class);

    @Bean
    public TraceabilityConfig traceabilityConfig(TraceabilityProperties properties) {
        TraceabilityConfig config = properties.toConfig();
        log.debug("Project root resolved to {}", config.projectRoot());
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionControlGateway versionControlGateway(TraceabilityConfig config) {
        return new GitCliGateway(config);
    }
}
