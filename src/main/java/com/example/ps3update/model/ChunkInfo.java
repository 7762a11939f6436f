package com.example.ps3update.model;

import lombok.Data;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 分片任务信息
 * <p>
 * 记录每个工作线程负责的字节范围 [start, end]（闭区间）以及当前写入位置。
 * end 为 -1 表示总长度未知的流式分片。
 * </p>
 */
@Data
public class ChunkInfo {
    private final int index; // 分片序号
    private final long start; // 起始字节位置
    private final long end; // 结束字节位置（含）
    private final AtomicLong current; // 已写入的最高位置(绝对位置, 不含)
    private volatile int errorCount; // 错误次数
    private volatile boolean finished; // 是否完成

    public ChunkInfo(int index, long start, long end) {
        this.index = index;
        this.start = start;
        this.end = end;
        this.current = new AtomicLong(start);
    }

    public static ChunkInfo stream() {
        return new ChunkInfo(0, 0, -1);
    }

    public boolean isBounded() {
        return end >= 0;
    }

    /**
     * @return 分片长度，流式分片返回 -1
     */
    public long length() {
        return isBounded() ? end - start + 1 : -1;
    }

    public long getCurrentPos() {
        return current.get();
    }
}
