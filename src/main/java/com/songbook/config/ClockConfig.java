package com.songbook.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 统一时间源：所有 joinedAt/promotedAt/changedAt 都从这里取，测试里可以换成固定时钟。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.timezone:UTC}") String timezone) {
        String zone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        return Clock.system(ZoneId.of(zone));
    }
}
