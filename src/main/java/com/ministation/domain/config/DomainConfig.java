package com.ministation.domain.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StationProperties.class)
public class DomainConfig {

    /**
     * 所有“当前时间”都从这里读：过期判断只依赖（存储的时间戳, now）。
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
