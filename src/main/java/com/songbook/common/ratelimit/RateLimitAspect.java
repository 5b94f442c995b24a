package com.songbook.common.ratelimit;

import com.songbook.auth.Actor;
import com.songbook.auth.web.AuthContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.List;

/**
 * 固定窗口限流：Redis INCR + EXPIRE（Lua 保证原子），超限时返回剩余 TTL 作为 retry-after。
 */
@Slf4j
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitProperties props;
    private final StringRedisTemplate redis;

    private final DefaultRedisScript<Long> script = buildScript();

    @Around("@annotation(com.songbook.common.ratelimit.RateLimit)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        if (!props.isEnabled()) {
            return pjp.proceed();
        }
        RateLimit rateLimit = ((MethodSignature) pjp.getSignature()).getMethod().getAnnotation(RateLimit.class);
        HttpServletRequest req = currentRequest();
        String key = rateLimit == null ? null : buildKey(req, rateLimit);
        if (key == null) {
            return pjp.proceed();
        }

        Long retryAfter;
        try {
            retryAfter = redis.execute(
                    script,
                    List.of(key),
                    String.valueOf(Math.max(1, rateLimit.windowSeconds())),
                    String.valueOf(Math.max(1, rateLimit.max()))
            );
        } catch (Exception e) {
            if (!props.isFailOpen()) {
                throw new RateLimitExceededException("too_many_requests", Math.max(1, rateLimit.windowSeconds()));
            }
            log.debug("ratelimit redis failed, fail-open: name={}, err={}", rateLimit.name(), e.toString());
            return pjp.proceed();
        }
        if (retryAfter != null && retryAfter > 0) {
            throw new RateLimitExceededException("too_many_requests", retryAfter);
        }
        return pjp.proceed();
    }

    String buildKey(HttpServletRequest req, RateLimit rateLimit) {
        String value = null;
        if (rateLimit.key() == RateLimitKey.IP) {
            value = resolveIp(req);
        } else if (rateLimit.key() == RateLimitKey.USER) {
            Actor actor = AuthContext.currentActor();
            value = actor.isAuthenticated() ? String.valueOf(actor.userId()) : null;
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        String prefix = props.getKeyPrefix() == null ? "" : props.getKeyPrefix();
        return prefix + rateLimit.name() + ":" + rateLimit.key().name() + ":" + value;
    }

    String resolveIp(HttpServletRequest req) {
        if (req == null) {
            return null;
        }
        if (props.isTrustForwardedHeaders()) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return req.getRemoteAddr();
    }

    private HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
            return attrs.getRequest();
        }
        return null;
    }

    private static DefaultRedisScript<Long> buildScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local c = redis.call('INCR', KEYS[1])
                if c == 1 then
                  redis.call('EXPIRE', KEYS[1], ARGV[1])
                end
                if c > tonumber(ARGV[2]) then
                  local ttl = redis.call('TTL', KEYS[1])
                  if ttl < 0 then ttl = tonumber(ARGV[1]) end
                  return ttl
                end
                return 0
                """);
        return s;
    }
}
