package com.songbook.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.songbook.auth.Actor;
import com.songbook.auth.service.JwtService;
import com.songbook.common.api.ApiCodes;
import com.songbook.common.api.Result;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * 轻量鉴权拦截器：
 * <ul>
 *   <li>没有 Authorization 头：放行，AuthContext 为 {@link Actor#NONE}（只读接口可匿名访问）</li>
 *   <li>带 Bearer token：解析成 Actor 放进 AuthContext</li>
 *   <li>token 无效：直接 401，统一 Result JSON</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return true;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            Actor actor = jwtService.toActor(jws.getPayload());
            request.setAttribute(REQ_ATTR_USER_ID, actor.userId());
            AuthContext.set(actor);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setCharacterEncoding("UTF-8");
            response.setContentType("application/json;charset=UTF-8");
            response.getWriter().write(objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized")));
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }
}
