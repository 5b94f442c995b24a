package com.songbook.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "songbook.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {
}
