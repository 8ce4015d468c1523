package com.lawnsim.config;

import com.lawnsim.engine.SimulationConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
public class SimulationConfiguration {

    @Bean
    public SimulationConfig simulationConfig(SimulationProperties properties) {
        return properties.toSimulationConfig();
    }
}
