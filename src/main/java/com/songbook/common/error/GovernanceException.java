package com.songbook.common.error;

/**
 * 引擎可恢复错误的基类：message 就是原因码（snake_case），调用方据此翻译成展示文案。
 *
 * <p>引擎只抛出最具体的子类，不做包装。</p>
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String reason) {
        super(reason);
    }

    public String reason() {
        return getMessage();
    }
}
