package com.songbook.auth;

import com.songbook.common.error.AuthenticationRequiredException;

/**
 * 调用方身份：身份提供方给出的稳定 userId + 是否匿名。
 *
 * <p>userId 为空表示未登录。匿名用户有 userId，但不能建群、申请入群或编辑内容。</p>
 */
public record Actor(Long userId, boolean anonymous) {

    public static final Actor NONE = new Actor(null, true);

    public static Actor user(long userId) {
        return new Actor(userId, false);
    }

    public static Actor anonymousUser(long userId) {
        return new Actor(userId, true);
    }

    public boolean isAuthenticated() {
        return userId != null && userId > 0;
    }

    /** 已登录且不是匿名会话。 */
    public boolean isRegistered() {
        return isAuthenticated() && !anonymous;
    }

    public boolean is(Long otherUserId) {
        return isAuthenticated() && userId.equals(otherUserId);
    }

    /** 要求已登录（匿名会话也可以），返回 userId。 */
    public long requireUserId() {
        if (!isAuthenticated()) {
            throw new AuthenticationRequiredException("unauthorized");
        }
        return userId;
    }

    /** 要求正式账号，匿名会话同样拒绝。 */
    public long requireRegistered() {
        if (!isRegistered()) {
            throw new AuthenticationRequiredException("registered_user_required");
        }
        return userId;
    }
}
