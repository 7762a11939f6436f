package com.example.ps3update.exception;

/**
 * 本地文件系统错误（目录创建、文件预分配、写入失败），不参与重试
 */
public class DownloadIoException extends Ps3UpdateException {

    public DownloadIoException(String message, Throwable cause) {
        super("File system error: " + message, cause);
    }
}
