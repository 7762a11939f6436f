package com.example.ps3update.model;

import lombok.Builder;
import lombok.Value;

/**
 * 下载进度快照，供轮询或推送使用
 */
@Value
@Builder
public class ProgressInfo {
    String jobId;
    String filename;
    DownloadStatus status;
    String mode; // 实际使用的模式，可能因降级与请求的不同
    int parts;
    long total; // 未探测到时为 0
    long downloaded;
    double percent;
    double speedBytesPerSec;
    String speedHuman;
    boolean done;
    String error;
}
