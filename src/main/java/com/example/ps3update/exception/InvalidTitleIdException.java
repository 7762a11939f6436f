package com.example.ps3update.exception;

/**
 * Title ID 格式非法（清洗后不符合 4 字母 + 5 数字）
 */
public class InvalidTitleIdException extends Ps3UpdateException {

    private final String rawTitleId;

    public InvalidTitleIdException(String rawTitleId) {
        super("Invalid title ID: " + rawTitleId);
        this.rawTitleId = rawTitleId;
    }

    public String getRawTitleId() {
        return rawTitleId;
    }
}
