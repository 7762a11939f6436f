package com.example.ps3update.exception;

/**
 * 服务器返回非成功状态或空响应体
 */
public class NoUpdatesFoundException extends Ps3UpdateException {

    private final String titleId;

    public NoUpdatesFoundException(String titleId) {
        super("No updates found for title ID: " + titleId);
        this.titleId = titleId;
    }

    public String getTitleId() {
        return titleId;
    }
}
