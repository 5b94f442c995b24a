package com.songbook.common.error;

/** 目标当前状态不允许该操作，例如审批非 pending 的申请。 */
public class InvalidStateException extends GovernanceException {

    public InvalidStateException(String reason) {
        super(reason);
    }
}
