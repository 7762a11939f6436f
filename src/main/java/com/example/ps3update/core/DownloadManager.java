package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.exception.DownloadIoException;
import com.example.ps3update.exception.JobNotFoundException;
import com.example.ps3update.model.DownloadMode;
import com.example.ps3update.model.ProgressInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 下载管理器
 * <p>
 * 持有本实例的任务表（任务 ID → 任务），负责启动、查询、取消和移除下载任务。
 * 启动调用立即返回任务 ID，之后的失败只记录在任务进度中，通过轮询获取。
 * </p>
 */
@Slf4j
public class DownloadManager implements AutoCloseable {

    private final Map<String, DownloadJob> jobs = new ConcurrentHashMap<>();
    private final HttpClientFactory httpClientFactory;
    private final ResourceProber prober;
    private final Ps3Properties.Download settings;
    private final ExecutorService jobExecutor;

    public DownloadManager(HttpClientFactory httpClientFactory, Ps3Properties properties) {
        this(httpClientFactory, new ResourceProber(), properties);
    }

    public DownloadManager(HttpClientFactory httpClientFactory, ResourceProber prober, Ps3Properties properties) {
        this.httpClientFactory = httpClientFactory;
        this.prober = prober;
        this.settings = properties.getDownload();
        AtomicInteger counter = new AtomicInteger();
        this.jobExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ps3-job-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 创建并异步启动下载任务
     *
     * @param url 下载地址
     * @param destPath 目标文件路径，父目录不存在时自动创建
     * @param mode 请求的下载模式，分片不可用时静默降级为单流
     * @return 任务 ID
     * @throws DownloadIoException 无法创建或写入父目录
     */
    public String startDownload(String url, Path destPath, DownloadMode mode) {
        Path target = destPath.toAbsolutePath();
        Path parent = target.getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DownloadIoException("Cannot create directory " + parent, e);
        }
        if (!Files.isWritable(parent)) {
            throw new DownloadIoException("Directory is not writable: " + parent, null);
        }

        DownloadJob job;
        String jobId;
        do {
            jobId = String.format(Locale.ROOT, "%016x", ThreadLocalRandom.current().nextLong());
            job = new DownloadJob(jobId, url, target, mode, httpClientFactory, prober, settings);
        } while (jobs.putIfAbsent(jobId, job) != null);

        try {
            jobExecutor.execute(job);
        } catch (RejectedExecutionException e) {
            jobs.remove(jobId);
            throw new IllegalStateException("DownloadManager is closed", e);
        }
        log.info("创建新下载任务: {}, URL: {}, 目标: {}, 模式: {}", jobId, url, target, mode);
        return jobId;
    }

    /**
     * 获取任务进度快照，不阻塞、不等待网络
     *
     * @throws JobNotFoundException 任务不存在
     */
    public ProgressInfo getProgress(String jobId) {
        return requireJob(jobId).snapshot();
    }

    /**
     * 取消任务：所有分片在下一个缓冲区边界停止，已写入的数据保留在磁盘上。
     * 已结束的任务不受影响。
     *
     * @throws JobNotFoundException 任务不存在
     */
    public void cancelDownload(String jobId) {
        DownloadJob job = requireJob(jobId);
        if (!job.cancel()) {
            log.info("任务 {} 已结束 ({}), 忽略取消请求", jobId, job.getStatus());
        }
    }

    /**
     * 移除已结束任务的记录，不删除文件。任务不存在时什么也不做；
     * 仍在运行的任务不会被移除。
     *
     * @return 是否移除了记录
     */
    public boolean removeJob(String jobId) {
        DownloadJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        if (!job.getStatus().isTerminal()) {
            log.warn("任务 {} 仍在运行 ({}), 不能移除", jobId, job.getStatus());
            return false;
        }
        boolean removed = jobs.remove(jobId, job);
        if (removed) {
            log.info("移除任务记录: {}", jobId);
        }
        return removed;
    }

    public List<ProgressInfo> getAllProgress() {
        List<ProgressInfo> result = new ArrayList<>(jobs.size());
        for (DownloadJob job : jobs.values()) {
            result.add(job.snapshot());
        }
        return result;
    }

    public boolean hasJobs() {
        return !jobs.isEmpty();
    }

    DownloadJob getJob(String jobId) {
        return jobs.get(jobId);
    }

    private DownloadJob requireJob(String jobId) {
        DownloadJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * 取消所有未结束的任务并关闭线程池
     */
    @Override
    public void close() {
        log.info("关闭下载管理器, 任务数: {}", jobs.size());
        jobs.values().forEach(DownloadJob::cancel);
        jobExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
