package com.example.ps3update.config;

import com.example.ps3update.core.DownloadManager;
import com.example.ps3update.core.HttpClientFactory;
import com.example.ps3update.core.UpdateFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 核心组件装配
 */
@Configuration
public class CoreConfig {

    @Bean
    public HttpClientFactory httpClientFactory(Ps3Properties properties) {
        return new HttpClientFactory(properties);
    }

    @Bean
    public UpdateFetcher updateFetcher(HttpClientFactory httpClientFactory, Ps3Properties properties) {
        return new UpdateFetcher(httpClientFactory, properties);
    }

    @Bean(destroyMethod = "close")
    public DownloadManager downloadManager(HttpClientFactory httpClientFactory, Ps3Properties properties) {
        return new DownloadManager(httpClientFactory, properties);
    }
}
