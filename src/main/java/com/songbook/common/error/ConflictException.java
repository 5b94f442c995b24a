package com.songbook.common.error;

/** 与现有记录冲突：重复的 pending 申请、直接移除群主、乐观锁写入失败等。 */
public class ConflictException extends GovernanceException {

    public static final String CONCURRENT_MODIFICATION = "concurrent_modification";

    public ConflictException(String reason) {
        super(reason);
    }
}
