package com.example.ps3update.core;

import com.example.ps3update.model.DownloadStatus;
import com.example.ps3update.model.ProgressInfo;
import com.example.ps3update.util.FormatUtils;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个任务的进度聚合
 * <p>
 * 已下载字节只由各分片以正增量累加，轮询方看到的值单调不减；
 * 终止状态只能进入一次，先到者的错误信息生效。
 * </p>
 */
public class ProgressTracker {

    private static final long SAMPLE_INTERVAL_NANOS = 200_000_000L;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong downloaded = new AtomicLong();
    private final AtomicInteger finishedParts = new AtomicInteger();
    private final SpeedWindow speedWindow;

    private volatile int partCount = 1;
    private volatile DownloadStatus status = DownloadStatus.CREATED;
    private volatile String error;
    private volatile long lastSampleNanos;

    public ProgressTracker(long speedWindowNanos) {
        this.speedWindow = new SpeedWindow(speedWindowNanos);
        long now = System.nanoTime();
        this.lastSampleNanos = now;
        speedWindow.record(now, 0);
    }

    public void setTotal(long totalBytes) {
        total.set(Math.max(totalBytes, 0));
    }

    /**
     * 总长度未知时用实际下载量补齐
     */
    public void setTotalIfUnknown(long totalBytes) {
        total.compareAndSet(0, Math.max(totalBytes, 0));
    }

    public void setPartCount(int partCount) {
        this.partCount = partCount;
    }

    public void addBytes(long delta) {
        if (delta <= 0) {
            return;
        }
        long value = downloaded.addAndGet(delta);
        long now = System.nanoTime();
        if (now - lastSampleNanos >= SAMPLE_INTERVAL_NANOS) {
            lastSampleNanos = now;
            speedWindow.record(now, value);
        }
    }

    public long getDownloaded() {
        return downloaded.get();
    }

    public long getTotal() {
        return total.get();
    }

    public DownloadStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public int getFinishedParts() {
        return finishedParts.get();
    }

    /**
     * 非终止状态之间的流转
     */
    public synchronized boolean transition(DownloadStatus from, DownloadStatus to) {
        if (status != from) {
            return false;
        }
        status = to;
        return true;
    }

    /**
     * 进入终止状态；已经终止时返回 false 且不覆盖原有错误
     */
    public synchronized boolean finish(DownloadStatus terminal, String message) {
        if (status.isTerminal()) {
            return false;
        }
        error = message;
        status = terminal;
        return true;
    }

    /**
     * 分片完成计数，最后一个分片完成时任务进入 DONE
     *
     * @return 本次调用是否使任务完成
     */
    public boolean partFinished() {
        if (finishedParts.incrementAndGet() != partCount) {
            return false;
        }
        synchronized (this) {
            if (status != DownloadStatus.RUNNING) {
                return false;
            }
            status = DownloadStatus.DONE;
            return true;
        }
    }

    public ProgressInfo snapshot(String jobId, String filename, String mode) {
        DownloadStatus current = status;
        String currentError = error;
        long bytes = downloaded.get();
        long totalBytes = total.get();

        double percent;
        if (totalBytes > 0) {
            percent = Math.min(100.0, bytes * 100.0 / totalBytes);
        } else {
            percent = current == DownloadStatus.DONE ? 100.0 : 0.0;
        }
        double speed = current.isTerminal() ? 0 : speedWindow.rate(System.nanoTime(), bytes);

        return ProgressInfo.builder()
                .jobId(jobId)
                .filename(filename)
                .status(current)
                .mode(mode)
                .parts(partCount)
                .total(totalBytes)
                .downloaded(bytes)
                .percent(Math.max(0.0, percent))
                .speedBytesPerSec(speed)
                .speedHuman(FormatUtils.formatSpeed(speed))
                .done(current.isTerminal())
                .error(currentError)
                .build();
    }
}
