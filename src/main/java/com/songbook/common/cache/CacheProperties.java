package com.songbook.common.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "songbook.cache")
public class CacheProperties {

    private boolean enabled = true;

    /** 群基础信息（名称/slug/加入策略/是否系统群）缓存时间。 */
    private long groupBaseTtlSeconds = 600;

    /** 社区群 id 的本机缓存时间。 */
    private long communityGroupTtlSeconds = 300;
}
