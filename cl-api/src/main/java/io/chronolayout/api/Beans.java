package io.chronolayout.api;

import io.chronolayout.core.LayoutEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LayoutProperties.class)
public class Beans {
    private static final Logger log = LoggerFactory.getLogger(Beans.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    LayoutEngine layoutEngine(LayoutProperties props, Clock clock) {
        var engine = new LayoutEngine(props.toConfig(), props.strategyOrDefault(), props.positioner(), clock);
        log.info("Layout engine: strategy={}, columns={}", engine.strategy(), engine.positioner().name());
        return engine;
    }
}
