package com.songbook.common.ratelimit;

/** 限流维度。 */
public enum RateLimitKey {
    USER,
    IP
}
