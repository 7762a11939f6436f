package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.exception.DownloadIoException;
import com.example.ps3update.model.ChunkInfo;
import com.example.ps3update.model.DownloadMode;
import com.example.ps3update.model.DownloadStatus;
import com.example.ps3update.model.ProbeResult;
import com.example.ps3update.model.ProgressInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.impl.client.CloseableHttpClient;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 下载任务上下文
 * <p>
 * 负责单个文件的探测、模式选择（分片不可用时静默降级为单流）、分片调度、
 * 状态流转和失败策略：第一个彻底失败的分片使整个任务失败并停止其余分片，
 * 已写入的文件保留在磁盘上。
 * </p>
 */
@Slf4j
public class DownloadJob implements Runnable {

    public static final String CANCELLED_MESSAGE = "Download cancelled";

    private final String id;
    private final String url;
    private final Path target;
    private final DownloadMode requestedMode;
    private final HttpClientFactory httpClientFactory;
    private final ResourceProber prober;
    private final Ps3Properties.Download settings;
    private final ProgressTracker tracker;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Map<Integer, ChunkWorker> activeWorkers = new ConcurrentHashMap<>();
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final AtomicBoolean resourcesClosed = new AtomicBoolean();

    private volatile DownloadMode effectiveMode;
    private volatile boolean supportRange;

    private CloseableHttpClient client;
    private RandomAccessFile file;
    private FileChannel channel;
    private ForkJoinPool chunkExecutor;

    public DownloadJob(String id, String url, Path target, DownloadMode requestedMode,
                       HttpClientFactory httpClientFactory, ResourceProber prober, Ps3Properties.Download settings) {
        this.id = id;
        this.url = url;
        this.target = target;
        this.requestedMode = requestedMode;
        this.effectiveMode = requestedMode;
        this.httpClientFactory = httpClientFactory;
        this.prober = prober;
        this.settings = settings;
        this.tracker = new ProgressTracker(settings.getSpeedWindow().toNanos());
    }

    @Override
    public void run() {
        if (!tracker.transition(DownloadStatus.CREATED, DownloadStatus.PROBING)) {
            log.info("任务 {} 在开始前已结束，状态: {}", id, tracker.getStatus());
            return;
        }
        log.info("开始启动下载任务：{}, URL: {}, 请求模式: {}", id, url, requestedMode);
        try {
            client = httpClientFactory.createHttpClient(requestedMode.getParts() + 1);
            ProbeResult probe = prober.probe(client, url);
            supportRange = probe.isSupportRange();
            if (probe.isSizeKnown()) {
                tracker.setTotal(probe.getTotalSize());
            }
            if (!isRunning()) {
                log.info("任务 {} 在探测阶段被取消", id);
                closeResources();
                return;
            }

            List<ChunkInfo> planned = plan(probe);
            tracker.setPartCount(planned.size());

            if (!tracker.transition(DownloadStatus.PROBING, DownloadStatus.RUNNING)) {
                log.info("任务 {} 在探测阶段被取消", id);
                closeResources();
                return;
            }
            log.info("任务 {} 开始下载, 模式: {}, 总大小: {}, 支持Range: {}",
                    id, effectiveMode, probe.getTotalSize(), supportRange);
            submitWorkers(planned);
        } catch (DownloadIoException e) {
            log.error("任务 {} 无法写入目标文件 {}", id, target, e);
            fail(e.getMessage());
            closeResources();
        } catch (RuntimeException e) {
            log.error("任务 {} 启动失败", id, e);
            fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            closeResources();
        }
    }

    /**
     * 选择模式并打开目标文件；分片不可用时降级为单流
     */
    private List<ChunkInfo> plan(ProbeResult probe) {
        if (requestedMode.isMultiPart()) {
            try {
                int parts = multiPartCount(probe);
                openFile(probe.getTotalSize());
                effectiveMode = DownloadMode.multiPart(parts);
                return ChunkPlanner.split(probe.getTotalSize(), parts);
            } catch (RangeUnsupportedException e) {
                log.info("任务 {} 无法分片下载 ({}), 使用单流下载", id, e.getMessage());
            }
        }
        effectiveMode = DownloadMode.direct();
        openFile(0);
        if (probe.isSizeKnown()) {
            return Collections.singletonList(new ChunkInfo(0, 0, probe.getTotalSize() - 1));
        }
        return Collections.singletonList(ChunkInfo.stream());
    }

    private int multiPartCount(ProbeResult probe) {
        if (!probe.isSizeKnown()) {
            throw new RangeUnsupportedException("total size unknown");
        }
        if (!probe.isSupportRange()) {
            throw new RangeUnsupportedException("server does not support range requests");
        }
        int parts = ChunkPlanner.effectiveParts(probe.getTotalSize(), requestedMode.getParts(),
                settings.getMinPartSize().toBytes());
        if (parts < 2) {
            throw new RangeUnsupportedException("file too small to split (" + probe.getTotalSize() + " bytes)");
        }
        return parts;
    }

    /**
     * 打开目标文件；size > 0 时预分配，使各分片可以乱序写入各自偏移
     */
    private void openFile(long size) {
        try {
            if (file == null) {
                file = new RandomAccessFile(target.toFile(), "rw");
                channel = file.getChannel();
            }
        } catch (IOException e) {
            throw new DownloadIoException("Cannot open " + target, e);
        }
        try {
            file.setLength(size);
        } catch (IOException e) {
            if (size > 0) {
                throw new RangeUnsupportedException("pre-allocation failed: " + e.getMessage());
            }
            throw new DownloadIoException("Cannot truncate " + target, e);
        }
    }

    private void submitWorkers(List<ChunkInfo> planned) {
        chunkExecutor = new ForkJoinPool(Math.min(planned.size() + 1, 32));
        liveWorkers.set(planned.size());
        for (ChunkInfo chunk : planned) {
            ChunkWorker worker = new ChunkWorker(this, chunk);
            activeWorkers.put(chunk.getIndex(), worker);
            chunkExecutor.execute(worker);
        }
    }

    void onPartFinished(ChunkInfo chunk) {
        log.debug("任务 [{}] 分片 {} 完成", id, chunk.getIndex());
        if (tracker.partFinished()) {
            log.info("任务 {} 所有分片下载完成！文件: {}", id, target);
        }
    }

    void onPartFailed(ChunkInfo chunk, String message) {
        if (fail(message)) {
            log.error("任务 {} 因分片 {} 失败而终止: {}", id, chunk.getIndex(), message);
        }
    }

    private boolean fail(String message) {
        if (tracker.finish(DownloadStatus.FAILED, message)) {
            stop();
            return true;
        }
        return false;
    }

    /**
     * 取消任务，已终止的任务不受影响
     *
     * @return 本次调用是否使任务进入 CANCELLED
     */
    public boolean cancel() {
        if (!tracker.finish(DownloadStatus.CANCELLED, CANCELLED_MESSAGE)) {
            return false;
        }
        log.info("取消下载任务: {}", id);
        // 资源由最后退出的分片释放；尚在探测阶段时由任务线程释放
        stop();
        return true;
    }

    /**
     * 停止信号：所有分片在下一个缓冲区边界退出，阻塞中的请求被中断
     */
    private void stop() {
        running.set(false);
        stopSignal.countDown();
        activeWorkers.values().forEach(ChunkWorker::abort);
    }

    void workerExited(ChunkWorker worker) {
        activeWorkers.remove(worker.getChunkInfo().getIndex());
        if (liveWorkers.decrementAndGet() == 0) {
            closeResources();
        }
    }

    /**
     * 关闭 HTTP 客户端、文件句柄和线程池，只执行一次
     */
    void closeResources() {
        if (!resourcesClosed.compareAndSet(false, true)) {
            return;
        }
        if (chunkExecutor != null) {
            chunkExecutor.shutdown();
        }
        try {
            if (channel != null) {
                channel.close();
            }
            if (file != null) {
                file.close();
            }
        } catch (IOException e) {
            log.warn("任务 {} 关闭文件失败: {}", id, target, e);
        }
        try {
            if (client != null) {
                client.close();
            }
        } catch (IOException e) {
            log.warn("任务 {} 关闭 HttpClient 失败", id, e);
        }
        log.debug("任务 {} 资源已释放", id);
    }

    /**
     * 退避等待，期间收到停止信号立即返回
     *
     * @return 是否收到了停止信号
     */
    boolean awaitStop(long millis) {
        try {
            return stopSignal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    long retryDelayMillis(int attempt) {
        long base = settings.getRetryBackoff().toMillis();
        long max = settings.getMaxRetryBackoff().toMillis();
        long delay = base << Math.min(attempt - 1, 20);
        return Math.min(delay, max);
    }

    public ProgressInfo snapshot() {
        return tracker.snapshot(id, target.getFileName().toString(), effectiveMode.toString());
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public Path getTarget() {
        return target;
    }

    public DownloadStatus getStatus() {
        return tracker.getStatus();
    }

    boolean isRunning() {
        return running.get();
    }

    boolean isMultiPart() {
        return effectiveMode.isMultiPart();
    }

    boolean isSupportRange() {
        return supportRange;
    }

    ProgressTracker getTracker() {
        return tracker;
    }

    CloseableHttpClient getClient() {
        return client;
    }

    FileChannel getChannel() {
        return channel;
    }

    int getBufferSize() {
        return (int) Math.max(settings.getBufferSize().toBytes(), 1024);
    }

    int getMaxRetries() {
        return settings.getMaxRetries();
    }
}
