package com.ministation.config;

import com.fasterxml.jackson.databind.Module;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot 会把容器里的 {@link Module} 注册到默认 ObjectMapper。
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Module stationIdJsonModule() {
        return new StationIdJsonModule();
    }
}
