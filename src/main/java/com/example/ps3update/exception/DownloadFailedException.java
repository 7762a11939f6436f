package com.example.ps3update.exception;

/**
 * 传输失败（HTTP 错误状态、重试耗尽、Range 响应异常等）
 */
public class DownloadFailedException extends Ps3UpdateException {

    private final boolean retryable;

    public DownloadFailedException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DownloadFailedException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = false;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
