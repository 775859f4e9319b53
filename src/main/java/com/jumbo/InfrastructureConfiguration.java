package com.jumbo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.local.EventClock;
import com.jumbo.local.LocalInfrastructureModule;
import com.jumbo.local.SystemEventClock;
import com.jumbo.maintenance.EventTypeNormalizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(JumboProperties.class)
public class InfrastructureConfiguration {

    @Bean
    public EventClock eventClock() {
        return new SystemEventClock();
    }

    /**
     * Released by its own JVM shutdown hook, so no destroy method is declared here.
     */
    @Bean(destroyMethod = "")
    public LocalInfrastructureModule localInfrastructureModule(JumboProperties properties,
                                                               ObjectMapper objectMapper,
                                                               EventClock eventClock) {
        return new LocalInfrastructureModule(
            Path.of(properties.getRootDir()),
            properties.getBus().getDispatchThreads(),
            objectMapper,
            eventClock);
    }

    @Bean
    public EventTypeNormalizer eventTypeNormalizer(JumboProperties properties, ObjectMapper objectMapper) {
        return new EventTypeNormalizer(Path.of(properties.getRootDir()), objectMapper);
    }
}
