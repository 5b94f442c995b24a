package com.songbook.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "songbook.community")
public class CommunityProperties {

    /** 社区群（Public 群）的 slug，找不到 systemGroup 标记时按它兜底。 */
    private String slug = "public";

    /** 社区群名称。 */
    private String name = "Public";

    /** 启动时若社区群不存在，用该用户作为群主创建；0 表示不自动创建。 */
    private long bootstrapOwnerId = 0;

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getBootstrapOwnerId() {
        return bootstrapOwnerId;
    }

    public void setBootstrapOwnerId(long bootstrapOwnerId) {
        this.bootstrapOwnerId = bootstrapOwnerId;
    }
}
