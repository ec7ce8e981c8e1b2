package com.ministation.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.OptionalLong;

/**
 * 多实例部署时为每个节点分配不同的雪花 workerId，避免 ASSIGN_ID 撞号。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(IdGeneratorProperties.class)
public class IdGeneratorConfig {

    @Bean
    public IdentifierGenerator identifierGenerator(IdGeneratorProperties props) {
        OptionalLong workerId = props.effectiveWorkerId();
        if (workerId.isEmpty()) {
            log.info("id generator: no worker id configured, using MyBatis-Plus default");
            return DefaultIdentifierGenerator.getInstance();
        }
        long datacenterId = props.effectiveDatacenterId();
        log.info("id generator: workerId={}, datacenterId={}, instanceId={}",
                workerId.getAsLong(), datacenterId, props.getInstanceId());
        return new DefaultIdentifierGenerator(workerId.getAsLong(), datacenterId);
    }
}
