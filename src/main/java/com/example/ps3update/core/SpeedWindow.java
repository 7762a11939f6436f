package com.example.ps3update.core;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 滑动窗口测速：保存 (时间, 已下载字节) 采样点，速度 = 窗口内字节增量 / 时间差
 */
public class SpeedWindow {

    private final long windowNanos;
    private final Deque<long[]> samples = new ArrayDeque<>();

    public SpeedWindow(long windowNanos) {
        this.windowNanos = windowNanos;
    }

    public synchronized void record(long nowNanos, long bytes) {
        long[] last = samples.peekLast();
        if (last != null && last[0] == nowNanos) {
            last[1] = Math.max(last[1], bytes);
        } else {
            samples.addLast(new long[]{nowNanos, bytes});
        }
        // 保留一个落在窗口边界之前的点作为基准
        while (samples.size() > 2) {
            long[] first = samples.pollFirst();
            long[] second = samples.peekFirst();
            if (second[0] > nowNanos - windowNanos) {
                samples.addFirst(first);
                break;
            }
        }
    }

    /**
     * 以当前值为终点、窗口起点前最近的采样为基准计算速度，不修改采样
     *
     * @return 字节/秒，没有可用基准时返回 0
     */
    public synchronized double rate(long nowNanos, long bytes) {
        long[] base = null;
        for (long[] sample : samples) {
            if (base == null || sample[0] <= nowNanos - windowNanos) {
                base = sample;
            } else {
                break;
            }
        }
        if (base == null || nowNanos <= base[0]) {
            return 0;
        }
        return Math.max(0, bytes - base[1]) * 1_000_000_000.0 / (nowNanos - base[0]);
    }
}
