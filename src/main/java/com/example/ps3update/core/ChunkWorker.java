package com.example.ps3update.core;

import com.example.ps3update.exception.DownloadFailedException;
import com.example.ps3update.exception.DownloadIoException;
import com.example.ps3update.model.ChunkInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.concurrent.RecursiveAction;

/**
 * 分片下载工作器
 * <p>
 * 负责单个分片的下载执行：按需发送 Range 请求，在自己的偏移处定位写入共享文件，
 * 网络类错误按指数退避重试，磁盘错误和明确的 HTTP 4xx 直接判定分片失败。
 * 每读到一个缓冲区检查一次任务的运行标志。
 * </p>
 */
@Slf4j
public class ChunkWorker extends RecursiveAction {

    private final DownloadJob job;
    private final ChunkInfo chunkInfo;
    private volatile HttpGet activeRequest;

    public ChunkWorker(DownloadJob job, ChunkInfo chunkInfo) {
        this.job = job;
        this.chunkInfo = chunkInfo;
    }

    public ChunkInfo getChunkInfo() {
        return chunkInfo;
    }

    /**
     * 中断正在进行的请求，阻塞中的读取会立即抛出异常
     */
    public void abort() {
        HttpGet request = activeRequest;
        if (request != null) {
            request.abort();
        }
    }

    @Override
    protected void compute() {
        try {
            runWithRetries();
        } finally {
            job.workerExited(this);
        }
    }

    private void runWithRetries() {
        int maxRetries = job.getMaxRetries();
        while (job.isRunning() && !chunkInfo.isFinished()) {
            try {
                download();
            } catch (DownloadIoException e) {
                if (job.isRunning()) {
                    log.error("任务 [{}] 分片 {} 写入文件失败", job.getId(), chunkInfo.getIndex(), e);
                    job.onPartFailed(chunkInfo, e.getMessage());
                }
                return;
            } catch (DownloadFailedException e) {
                if (!job.isRunning()) {
                    return;
                }
                if (!e.isRetryable()) {
                    job.onPartFailed(chunkInfo, e.getMessage());
                    return;
                }
                if (!backoff(maxRetries, e)) {
                    return;
                }
            } catch (IOException e) {
                if (!job.isRunning()) {
                    // 取消或其他分片失败时请求被中断
                    return;
                }
                if (!backoff(maxRetries, e)) {
                    return;
                }
            } catch (RuntimeException e) {
                log.error("任务 [{}] 分片 {} 出现未预期的错误", job.getId(), chunkInfo.getIndex(), e);
                job.onPartFailed(chunkInfo, describe(e));
                return;
            }
        }

        if (chunkInfo.isFinished()) {
            job.onPartFinished(chunkInfo);
        }
    }

    /**
     * 记录一次瞬时错误并等待退避时间
     *
     * @return false 表示重试次数耗尽（分片已判定失败）或等待期间任务被停止
     */
    private boolean backoff(int maxRetries, Exception cause) {
        chunkInfo.setErrorCount(chunkInfo.getErrorCount() + 1);
        int attempt = chunkInfo.getErrorCount();
        if (attempt > maxRetries) {
            log.error("任务 [{}] 分片 {} 失败次数过多，已停止", job.getId(), chunkInfo.getIndex(), cause);
            job.onPartFailed(chunkInfo, "Part " + chunkInfo.getIndex() + " failed after " + maxRetries
                    + " retries: " + describe(cause));
            return false;
        }
        long delay = job.retryDelayMillis(attempt);
        log.warn("任务 [{}] 分片 {} 下载出错: {}, {}ms 后重试 {}/{}",
                job.getId(), chunkInfo.getIndex(), describe(cause), delay, attempt, maxRetries);
        return !job.awaitStop(delay);
    }

    private void download() throws IOException {
        long startPos = chunkInfo.getCurrent().get();
        boolean resume = startPos > chunkInfo.getStart();
        boolean ranged = job.isMultiPart() || (resume && job.isSupportRange() && chunkInfo.isBounded());

        HttpGet request = new HttpGet(job.getUrl());
        long writePos;
        if (ranged) {
            String end = chunkInfo.isBounded() ? String.valueOf(chunkInfo.getEnd()) : "";
            request.addHeader("Range", "bytes=" + startPos + "-" + end);
            writePos = startPos;
        } else {
            // 不支持 Range 的流式下载只能从头覆盖写，已计入的字节不重复计数
            writePos = chunkInfo.getStart();
        }

        activeRequest = request;
        if (!job.isRunning()) {
            return;
        }
        try (CloseableHttpResponse response = job.getClient().execute(request)) {
            int code = response.getStatusLine().getStatusCode();
            checkStatus(code, ranged);

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new DownloadFailedException("Empty response body", true);
            }
            if (!ranged && !chunkInfo.isBounded() && entity.getContentLength() > 0) {
                job.getTracker().setTotalIfUnknown(entity.getContentLength());
            }

            boolean eof = copy(entity.getContent(), writePos);
            if (!eof) {
                // 提前结束（停止或分片写满），丢弃剩余响应体
                request.abort();
            }
        } finally {
            activeRequest = null;
        }

        if (chunkInfo.isBounded()) {
            if (chunkInfo.getCurrent().get() > chunkInfo.getEnd()) {
                chunkInfo.setFinished(true);
            } else if (job.isRunning()) {
                throw new IOException("Connection closed at " + chunkInfo.getCurrent().get()
                        + ", expected range end " + chunkInfo.getEnd());
            }
        } else if (job.isRunning()) {
            // 流读完就是完成
            job.getTracker().setTotalIfUnknown(chunkInfo.getCurrent().get());
            chunkInfo.setFinished(true);
        }
    }

    private void checkStatus(int code, boolean ranged) {
        if (ranged) {
            if (code == HttpStatus.SC_PARTIAL_CONTENT) {
                return;
            }
            if (code == HttpStatus.SC_OK) {
                throw new DownloadFailedException("Server ignored range request for part " + chunkInfo.getIndex(), false);
            }
        } else if (code >= 200 && code < 300) {
            return;
        }
        boolean retryable = code >= 500 || code == HttpStatus.SC_REQUEST_TIMEOUT || code == 429;
        throw new DownloadFailedException("HTTP error: " + code, retryable);
    }

    /**
     * @return 是否读到了响应流末尾
     */
    private boolean copy(InputStream is, long writePos) throws IOException {
        FileChannel channel = job.getChannel();
        byte[] buf = new byte[job.getBufferSize()];
        long limit = chunkInfo.isBounded() ? chunkInfo.getEnd() + 1 : Long.MAX_VALUE;
        long pos = writePos;
        int len;
        while (job.isRunning()) {
            if (pos >= limit) {
                return false;
            }
            len = is.read(buf);
            if (len == -1) {
                return true;
            }
            int writable = (int) Math.min(len, limit - pos);
            write(channel, buf, writable, pos);
            pos += writable;
            credit(pos);
        }
        return false;
    }

    private void write(FileChannel channel, byte[] buf, int len, long position) {
        ByteBuffer buffer = ByteBuffer.wrap(buf, 0, len);
        long offset = position;
        try {
            while (buffer.hasRemaining()) {
                offset += channel.write(buffer, offset);
            }
        } catch (IOException e) {
            if (!job.isRunning()) {
                // 任务已停止，文件句柄已关闭
                throw new DownloadFailedException("Write interrupted", e);
            }
            throw new DownloadIoException("Failed to write " + job.getTarget() + " at offset " + position, e);
        }
    }

    /**
     * 只为超过已计入高水位的部分累加进度
     */
    private void credit(long pos) {
        long high = chunkInfo.getCurrent().get();
        if (pos > high) {
            chunkInfo.getCurrent().set(pos);
            job.getTracker().addBytes(pos - high);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
