package com.songbook.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ASSIGN_ID 的雪花参数：多实例部署时必须给每个实例配置不同的 worker-id，否则可能撞 ID。
 */
@Configuration
public class IdWorkerConfig {
    private static final Logger log = LoggerFactory.getLogger(IdWorkerConfig.class);

    private final long datacenterId;
    private final long workerId;

    public IdWorkerConfig(
            @Value("${songbook.id.datacenter-id:1}") long datacenterId,
            @Value("${songbook.id.worker-id:-1}") long workerId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        if (workerId < 0) {
            log.info("IdWorker: keep default generator (no songbook.id.worker-id)");
            return DefaultIdentifierGenerator.getInstance();
        }
        long wid = normalize5Bits(workerId);
        long dc = normalize5Bits(datacenterId);
        log.info("IdWorker: workerId={}, datacenterId={}", wid, dc);
        return new DefaultIdentifierGenerator(wid, dc);
    }

    static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
