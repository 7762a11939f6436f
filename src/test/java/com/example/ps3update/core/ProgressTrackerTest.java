package com.example.ps3update.core;

import com.example.ps3update.model.DownloadStatus;
import com.example.ps3update.model.ProgressInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    private static ProgressTracker running(int parts, long total) {
        ProgressTracker tracker = new ProgressTracker(TimeUnit.SECONDS.toNanos(3));
        tracker.setTotal(total);
        tracker.setPartCount(parts);
        assertThat(tracker.transition(DownloadStatus.CREATED, DownloadStatus.PROBING)).isTrue();
        assertThat(tracker.transition(DownloadStatus.PROBING, DownloadStatus.RUNNING)).isTrue();
        return tracker;
    }

    @Test
    void doneOnlyWhenEveryPartFinished() {
        ProgressTracker tracker = running(3, 300);
        tracker.addBytes(300);

        assertThat(tracker.partFinished()).isFalse();
        assertThat(tracker.partFinished()).isFalse();
        assertThat(tracker.snapshot("j", "f", "m").isDone()).isFalse();
        assertThat(tracker.partFinished()).isTrue();

        ProgressInfo info = tracker.snapshot("j", "f.pkg", "MultiPart(3)");
        assertThat(info.isDone()).isTrue();
        assertThat(info.getStatus()).isEqualTo(DownloadStatus.DONE);
        assertThat(info.getError()).isNull();
        assertThat(info.getPercent()).isEqualTo(100.0);
        assertThat(info.getSpeedBytesPerSec()).isZero();
    }

    @Test
    void firstTerminalStateWins() {
        ProgressTracker tracker = running(2, 100);

        assertThat(tracker.finish(DownloadStatus.FAILED, "Part 1 failed")).isTrue();
        assertThat(tracker.finish(DownloadStatus.CANCELLED, "Download cancelled")).isFalse();
        assertThat(tracker.finish(DownloadStatus.FAILED, "Part 0 failed")).isFalse();
        tracker.partFinished();
        tracker.partFinished();

        assertThat(tracker.getStatus()).isEqualTo(DownloadStatus.FAILED);
        assertThat(tracker.getError()).isEqualTo("Part 1 failed");
    }

    @Test
    void nonTerminalTransitionsRequireExpectedState() {
        ProgressTracker tracker = new ProgressTracker(TimeUnit.SECONDS.toNanos(1));
        assertThat(tracker.transition(DownloadStatus.PROBING, DownloadStatus.RUNNING)).isFalse();
        tracker.finish(DownloadStatus.CANCELLED, "Download cancelled");
        assertThat(tracker.transition(DownloadStatus.CREATED, DownloadStatus.PROBING)).isFalse();
        assertThat(tracker.getStatus()).isEqualTo(DownloadStatus.CANCELLED);
    }

    @Test
    void percentIsClampedAndZeroWhileTotalUnknown() {
        ProgressTracker tracker = running(1, 0);
        tracker.addBytes(500);
        assertThat(tracker.snapshot("j", "f", "Direct").getPercent()).isZero();

        tracker.setTotal(400);
        assertThat(tracker.snapshot("j", "f", "Direct").getPercent()).isEqualTo(100.0);

        tracker.setTotal(1000);
        assertThat(tracker.snapshot("j", "f", "Direct").getPercent()).isEqualTo(50.0);
    }

    @Test
    void setTotalIfUnknownKeepsProbedValue() {
        ProgressTracker tracker = running(1, 0);
        tracker.setTotalIfUnknown(42);
        tracker.setTotalIfUnknown(99);
        assertThat(tracker.getTotal()).isEqualTo(42);
    }

    @Test
    void nonPositiveDeltasAreIgnored() {
        ProgressTracker tracker = running(1, 10);
        tracker.addBytes(5);
        tracker.addBytes(0);
        tracker.addBytes(-3);
        assertThat(tracker.getDownloaded()).isEqualTo(5);
    }

    @Test
    void concurrentIncrementsAreNeverLostAndNeverObservedDecreasing() throws Exception {
        int writers = 8;
        int increments = 20_000;
        ProgressTracker tracker = running(writers, (long) writers * increments);
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < increments; i++) {
                        tracker.addBytes(1);
                    }
                    tracker.partFinished();
                    return null;
                }));
            }
            Future<Boolean> poller = pool.submit(() -> {
                start.await();
                long last = 0;
                while (true) {
                    ProgressInfo info = tracker.snapshot("j", "f", "m");
                    if (info.getDownloaded() < last) {
                        return false;
                    }
                    last = info.getDownloaded();
                    if (info.isDone()) {
                        return true;
                    }
                }
            });
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
            assertThat(poller.get(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(tracker.getDownloaded()).isEqualTo((long) writers * increments);
        assertThat(tracker.getStatus()).isEqualTo(DownloadStatus.DONE);
        assertThat(tracker.getFinishedParts()).isEqualTo(writers);
    }
}
