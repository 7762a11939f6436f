package com.example.ps3update.core;

import com.example.ps3update.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.impl.client.CloseableHttpClient;

import java.io.IOException;

/**
 * 资源探测：总长度与 Range 支持
 * <p>
 * 先 HEAD；未声明 Accept-Ranges 或长度未知时再发 Range: bytes=0-0 试探，
 * 206 视为支持并从 Content-Range 取总长。探测失败不抛异常，只返回未知。
 * </p>
 */
@Slf4j
public class ResourceProber {

    public ProbeResult probe(CloseableHttpClient client, String url) {
        long total = -1;
        boolean supportRange = false;

        // 1. 尝试 HEAD
        try (CloseableHttpResponse response = client.execute(new HttpHead(url))) {
            int code = response.getStatusLine().getStatusCode();
            if (code >= 200 && code < 300) {
                total = contentLength(response);
                Header rangeHeader = response.getFirstHeader("Accept-Ranges");
                supportRange = rangeHeader != null && rangeHeader.getValue().toLowerCase().contains("bytes");
            }
            log.debug("HEAD {} -> {}, length={}, acceptRanges={}", url, code, total, supportRange);
        } catch (IOException e) {
            // 部分服务器禁用了 HEAD
            log.debug("HEAD {} 失败: {}", url, e.toString());
        }

        // 2. 没拿到大小或未声明 Range，尝试 GET (Range: 0-0) 探测
        if (!supportRange || total <= 0) {
            HttpGet get = new HttpGet(url);
            get.addHeader("Range", "bytes=0-0");
            try (CloseableHttpResponse response = client.execute(get)) {
                int code = response.getStatusLine().getStatusCode();
                if (code == HttpStatus.SC_PARTIAL_CONTENT) {
                    supportRange = true;
                    long fromRange = totalFromContentRange(response);
                    if (fromRange > 0) {
                        total = fromRange;
                    }
                } else {
                    if (code == HttpStatus.SC_OK && total <= 0) {
                        total = contentLength(response);
                    }
                    supportRange = false;
                    // 服务器返回了整个文件，不读取响应体
                    get.abort();
                }
                log.debug("GET Range 0-0 {} -> {}, length={}, supportRange={}", url, code, total, supportRange);
            } catch (IOException e) {
                log.debug("Range 探测 {} 失败: {}", url, e.toString());
            }
        }

        return total > 0 || supportRange ? new ProbeResult(total, supportRange && total > 0) : ProbeResult.unknown();
    }

    private static long contentLength(HttpResponse response) {
        Header lenHeader = response.getFirstHeader("Content-Length");
        if (lenHeader == null) {
            return -1;
        }
        try {
            return Long.parseLong(lenHeader.getValue().trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Content-Range: bytes 0-0/12345 -> 12345，总长为 * 时返回 -1
     */
    static long totalFromContentRange(HttpResponse response) {
        Header contentRange = response.getFirstHeader("Content-Range");
        if (contentRange == null) {
            return -1;
        }
        String val = contentRange.getValue();
        int slash = val.lastIndexOf('/');
        if (slash < 0) {
            return -1;
        }
        try {
            return Long.parseLong(val.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
