package com.example.ps3update.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单个更新包描述（解析后不可变）
 */
@Value
@Builder
public class PackageInfo {
    String version;
    String systemVersion; // 需要的最低系统版本 (ps3_system_ver)
    long sizeBytes;
    String sizeHuman;
    String url;
    String sha1; // 可能为空串
    String filename; // URL 最后一段
}
