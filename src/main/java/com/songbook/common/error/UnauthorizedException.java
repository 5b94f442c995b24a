package com.songbook.common.error;

/** 操作者缺少所需的角色或资历。 */
public class UnauthorizedException extends GovernanceException {

    public UnauthorizedException(String reason) {
        super(reason);
    }
}
