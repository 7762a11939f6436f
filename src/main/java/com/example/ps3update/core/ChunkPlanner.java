package com.example.ps3update.core;

import com.example.ps3update.model.ChunkInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 分片规划：把 [0, total) 切成连续、互不重叠的区间，最后一片吸收余数
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    public static List<ChunkInfo> split(long total, int count) {
        if (total <= 0) {
            throw new IllegalArgumentException("total must be > 0, got " + total);
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        int parts = (int) Math.min(count, total);
        long blockSize = total / parts;
        List<ChunkInfo> chunks = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            long start = i * blockSize;
            long end = (i == parts - 1) ? total - 1 : (i + 1) * blockSize - 1;
            chunks.add(new ChunkInfo(i, start, end));
        }
        return chunks;
    }

    /**
     * 根据最小分片大小计算实际分片数，小于 2 表示不值得分片
     */
    public static int effectiveParts(long total, int requested, long minPartSize) {
        if (total <= 0 || requested < 2) {
            return 1;
        }
        long bySize = minPartSize <= 0 ? requested : total / minPartSize;
        return (int) Math.max(1, Math.min(requested, bySize));
    }
}
