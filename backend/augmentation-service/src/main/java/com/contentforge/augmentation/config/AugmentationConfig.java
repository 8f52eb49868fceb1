package com.contentforge.augmentation.config;

import com.contentforge.augmentation.service.matching.ScoringPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AugmentationConfig {

    @Bean
    public ScoringPolicy scoringPolicy(AugmentationProperties properties) {
        return ScoringPolicy.from(properties.getScoring());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock augmentationClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
