package com.songbook.config;

import com.songbook.common.cache.CacheProperties;
import com.songbook.common.ratelimit.RateLimitProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationYamlParseTest {

    private static PropertySource<?> load() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        assertNotNull(sources);
        assertFalse(sources.isEmpty());
        return sources.get(0);
    }

    @Test
    void applicationYaml_ShouldDeclareCommunityAndCacheKeys() throws Exception {
        PropertySource<?> src = load();

        assertEquals("public", src.getProperty("songbook.community.slug"));
        assertEquals("Public", src.getProperty("songbook.community.name"));
        assertEquals("300", String.valueOf(src.getProperty("songbook.cache.community-group-ttl-seconds")));
        assertEquals("600", String.valueOf(src.getProperty("songbook.cache.group-base-ttl-seconds")));
        assertEquals("songbook", src.getProperty("songbook.auth.issuer"));
    }

    @Test
    void applicationYaml_ShouldBindToProperties() throws Exception {
        Binder binder = new Binder(ConfigurationPropertySources.from(load()));

        CacheProperties cache = binder.bind("songbook.cache", CacheProperties.class).get();
        assertTrue(cache.isEnabled());
        assertEquals(300, cache.getCommunityGroupTtlSeconds());
        assertEquals(600, cache.getGroupBaseTtlSeconds());

        RateLimitProperties rl = binder.bind("songbook.ratelimit", RateLimitProperties.class).get();
        assertFalse(rl.isTrustForwardedHeaders());
        assertEquals("songbook:rl:", rl.getKeyPrefix());
    }
}
