package com.example.ps3update.core;

import com.example.ps3update.exception.Ps3UpdateException;

/**
 * 无法分片下载，只在任务内部用于触发单流降级
 */
class RangeUnsupportedException extends Ps3UpdateException {

    RangeUnsupportedException(String reason) {
        super(reason);
    }
}
