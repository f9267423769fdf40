package com.chatsync.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 启动迁移前先 validate；校验和不一致（本地改过已执行的脚本）时 repair 一次再 migrate。
 *
 * <p>生产环境建议 chat.flyway.auto-repair=false，让校验失败直接阻止启动。</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            validateOrRepair(flyway);
            flyway.migrate();
        };
    }

    static void validateOrRepair(Flyway flyway) {
        try {
            flyway.validate();
        } catch (FlywayValidateException e) {
            log.warn("flyway validate failed, repairing schema history: {}", e.getMessage());
            flyway.repair();
        }
    }
}
