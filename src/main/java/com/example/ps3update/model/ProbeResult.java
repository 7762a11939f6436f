package com.example.ps3update.model;

import lombok.Value;

/**
 * 资源探测结果
 */
@Value
public class ProbeResult {

    private static final ProbeResult UNKNOWN = new ProbeResult(-1, false);

    long totalSize; // -1 表示未知
    boolean supportRange;

    public static ProbeResult unknown() {
        return UNKNOWN;
    }

    public boolean isSizeKnown() {
        return totalSize > 0;
    }
}
