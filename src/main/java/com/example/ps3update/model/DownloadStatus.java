package com.example.ps3update.model;

/**
 * 下载任务状态枚举
 * <p>
 * CREATED → PROBING → RUNNING → {DONE, FAILED, CANCELLED}
 * </p>
 */
public enum DownloadStatus {
    CREATED,    // 已登记，尚未开始
    PROBING,    // 探测资源（长度、Range 支持）
    RUNNING,    // 下载中
    DONE,       // 完成
    FAILED,     // 失败
    CANCELLED;  // 取消

    /**
     * 判断是否为终止状态（不可恢复的状态）
     *
     * @return 如果是 DONE, FAILED 或 CANCELLED 返回 true
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
