package com.example.ps3update.exception;

/**
 * 更新查询与下载相关异常的基类
 */
public class Ps3UpdateException extends RuntimeException {

    public Ps3UpdateException(String message) {
        super(message);
    }

    public Ps3UpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
