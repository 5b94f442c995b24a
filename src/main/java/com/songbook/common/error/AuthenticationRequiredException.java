package com.songbook.common.error;

/** 未登录或匿名身份调用了需要正式账号的操作。 */
public class AuthenticationRequiredException extends UnauthorizedException {

    public AuthenticationRequiredException(String reason) {
        super(reason);
    }
}
