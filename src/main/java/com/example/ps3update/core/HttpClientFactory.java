package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.DefaultHttpRequestRetryHandler;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.ssl.SSLContextBuilder;

import java.security.GeneralSecurityException;

/**
 * HTTP客户端工厂
 * <p>
 * 负责创建带超时、重定向、可选代理和可选信任全部证书的 HTTP 客户端
 * </p>
 */
@Slf4j
public class HttpClientFactory {

    private final Ps3Properties.Http http;
    private final boolean trustAllCertificates;

    public HttpClientFactory(Ps3Properties properties) {
        this.http = properties.getHttp();
        this.trustAllCertificates = properties.getUpdate().isTrustAllCertificates();
    }

    /**
     * 每个请求使用的超时配置
     */
    public RequestConfig requestConfig() {
        RequestConfig.Builder builder = RequestConfig.custom()
                .setConnectTimeout((int) http.getConnectTimeout().toMillis()) // 连接超时
                .setSocketTimeout((int) http.getSocketTimeout().toMillis()) // 读取超时
                .setConnectionRequestTimeout((int) http.getConnectionRequestTimeout().toMillis())
                .setRedirectsEnabled(true);
        if (http.getProxyHost() != null && http.getProxyPort() != null) {
            builder.setProxy(new HttpHost(http.getProxyHost(), http.getProxyPort()));
        }
        return builder.build();
    }

    /**
     * 创建 HttpClient，调用方负责关闭
     *
     * @param maxConnections 同一主机的最大并发连接数（分片数）
     */
    public CloseableHttpClient createHttpClient(int maxConnections) {
        int connections = Math.max(maxConnections, 2);
        HttpClientBuilder builder = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig())
                .setMaxConnPerRoute(connections)
                .setMaxConnTotal(connections)
                .setUserAgent(http.getUserAgent())
                // 失效的长连接上未收到响应的请求重放一次
                .setRetryHandler(new DefaultHttpRequestRetryHandler(1, false));

        if (http.getProxyHost() != null && http.getProxyPort() != null) {
            log.info("使用 HTTP 代理: {}:{}", http.getProxyHost(), http.getProxyPort());
        }

        if (trustAllCertificates) {
            try {
                builder.setSSLContext(new SSLContextBuilder().loadTrustMaterial(null, TrustAllStrategy.INSTANCE).build())
                        .setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to build trust-all SSL context", e);
            }
        }
        return builder.build();
    }

    public CloseableHttpClient createHttpClient() {
        return createHttpClient(2);
    }
}
