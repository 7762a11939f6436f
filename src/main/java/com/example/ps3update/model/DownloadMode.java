package com.example.ps3update.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 下载模式：单流直连 (Direct) 或分片并发 (MultiPart)
 */
@Getter
@EqualsAndHashCode
public final class DownloadMode {

    private static final DownloadMode DIRECT = new DownloadMode(1, false);

    private final int parts;
    private final boolean multiPart;

    private DownloadMode(int parts, boolean multiPart) {
        this.parts = parts;
        this.multiPart = multiPart;
    }

    public static DownloadMode direct() {
        return DIRECT;
    }

    public static DownloadMode multiPart(int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be >= 1, got " + parts);
        }
        return new DownloadMode(parts, true);
    }

    @Override
    public String toString() {
        return multiPart ? "MultiPart(" + parts + ")" : "Direct";
    }
}
