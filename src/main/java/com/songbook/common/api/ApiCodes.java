package com.songbook.common.api;

/**
 * 统一错误码定义（按 HTTP 语义分段）。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 已登录但角色/资历不够 */
    public static final int FORBIDDEN = 40300;

    /** 群/成员/申请/内容不存在 */
    public static final int NOT_FOUND = 40400;

    /** 状态不允许（例如重复审批、提升已是管理员的成员） */
    public static final int INVALID_STATE = 40900;

    /** 冲突（例如重复申请、直接移除群主、并发写入丢失） */
    public static final int CONFLICT = 40901;

    /** 限流 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
