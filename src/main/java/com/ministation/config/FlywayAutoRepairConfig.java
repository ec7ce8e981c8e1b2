package com.ministation.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 启动时迁移 station 库：校验失败（例如本地改过已执行的脚本）先 repair 再 migrate。
 */
@Configuration
@ConditionalOnProperty(name = "station.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayAutoRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return FlywayAutoRepairConfig::validateRepairMigrate;
    }

    static void validateRepairMigrate(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("Flyway: validate failed, running repair() before migrate()", e);
            try {
                flyway.repair();
            } catch (RuntimeException repairError) {
                log.warn("Flyway: repair() failed, continue migrate()", repairError);
            }
        }
        flyway.migrate();
    }
}
