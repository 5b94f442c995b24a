package com.songbook.auth.web;

import com.songbook.auth.Actor;

/**
 * 请求级别的“当前调用方”上下文。
 *
 * <p>ThreadLocal 必须在请求结束时清理，否则线程复用时会串号；
 * 由 AccessTokenInterceptor#afterCompletion 负责 clear。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Actor> ACTOR = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void set(Actor actor) {
        ACTOR.set(actor);
    }

    /** 没有 token 时返回 {@link Actor#NONE}，由 service 层决定是否拒绝。 */
    public static Actor currentActor() {
        Actor actor = ACTOR.get();
        return actor == null ? Actor.NONE : actor;
    }

    public static void clear() {
        ACTOR.remove();
    }
}
