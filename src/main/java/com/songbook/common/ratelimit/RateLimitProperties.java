package com.songbook.common.ratelimit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "songbook.ratelimit")
public class RateLimitProperties {

    private boolean enabled = true;

    /** 只有部署在可信反向代理之后才打开，否则 X-Forwarded-For 可被伪造。 */
    private boolean trustForwardedHeaders = false;

    /** Redis 不可用时放行。 */
    private boolean failOpen = true;

    private String keyPrefix = "songbook:rl:";
}
