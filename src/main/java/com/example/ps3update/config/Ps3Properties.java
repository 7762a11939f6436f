package com.example.ps3update.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * 应用配置，前缀 ps3
 * <p>
 * 核心类通过构造函数接收本对象，测试中可直接 new 出来使用
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "ps3")
public class Ps3Properties {

    private final Update update = new Update();
    private final Http http = new Http();
    private final Download download = new Download();

    @Data
    public static class Update {
        /**
         * 更新服务器地址
         */
        private String baseUrl = "https://a0.ww.np.dl.playstation.net";
        /**
         * 跳过证书校验（官方服务器证书无法通过默认校验）
         */
        private boolean trustAllCertificates = true;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration socketTimeout = Duration.ofSeconds(30);
        private Duration connectionRequestTimeout = Duration.ofSeconds(10);
        private String proxyHost;
        private Integer proxyPort;
        private String userAgent = "ps3-update-downloader/1.0";
    }

    @Data
    public static class Download {
        /**
         * 勾选多线程下载时的分片数
         */
        private int defaultParts = 4;
        /**
         * 单个分片的最小大小，文件过小时退回单流下载
         */
        private DataSize minPartSize = DataSize.ofMegabytes(1);
        private int maxRetries = 5;
        private Duration retryBackoff = Duration.ofMillis(500);
        private Duration maxRetryBackoff = Duration.ofSeconds(8);
        private DataSize bufferSize = DataSize.ofKilobytes(16);
        /**
         * 速度计算的滑动窗口
         */
        private Duration speedWindow = Duration.ofSeconds(3);
        private String defaultPath;
    }
}
