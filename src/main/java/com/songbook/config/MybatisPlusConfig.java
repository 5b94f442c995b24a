package com.songbook.config;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import org.apache.ibatis.reflection.MetaObject;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDateTime;

@Configuration
@MapperScan("com.songbook.**.mapper")
public class MybatisPlusConfig {

    /**
     * createdAt/updatedAt 自动填充（实体上用 FieldFill 标注）。
     *
     * <p>strictFill 只在字段为空时写入：service 层显式设置的时间优先。</p>
     */
    @Bean
    public MetaObjectHandler auditTimeMetaObjectHandler(Clock clock) {
        return new MetaObjectHandler() {
            @Override
            public void insertFill(MetaObject metaObject) {
                LocalDateTime now = LocalDateTime.now(clock);
                this.strictInsertFill(metaObject, "createdAt", LocalDateTime.class, now);
                this.strictInsertFill(metaObject, "updatedAt", LocalDateTime.class, now);
            }

            @Override
            public void updateFill(MetaObject metaObject) {
                this.strictUpdateFill(metaObject, "updatedAt", LocalDateTime.class, LocalDateTime.now(clock));
            }
        };
    }
}
