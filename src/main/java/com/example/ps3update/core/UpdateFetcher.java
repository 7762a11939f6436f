package com.example.ps3update.core;

import com.example.ps3update.config.Ps3Properties;
import com.example.ps3update.exception.NetworkException;
import com.example.ps3update.exception.NoUpdatesFoundException;
import com.example.ps3update.model.FetchResult;
import com.example.ps3update.model.PackageInfo;
import com.example.ps3update.util.FormatUtils;
import com.example.ps3update.util.VersionComparator;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 更新查询器
 * <p>
 * 根据 Title ID 请求官方 {baseUrl}/tpl/np/{ID}/{ID}-ver.xml，解析出按版本降序的更新包列表
 * </p>
 */
@Slf4j
public class UpdateFetcher {

    private static final Comparator<PackageInfo> NEWEST_FIRST =
            Comparator.comparing(PackageInfo::getVersion, VersionComparator.DESCENDING);

    private final HttpClientFactory httpClientFactory;
    private final String baseUrl;
    private final UpdateXmlParser parser = new UpdateXmlParser();

    public UpdateFetcher(HttpClientFactory httpClientFactory, Ps3Properties properties) {
        this.httpClientFactory = httpClientFactory;
        String url = properties.getUpdate().getBaseUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * 检查更新服务器是否可达，任何异常都视为不可达
     *
     * @return 收到任何 HTTP 响应返回 true
     */
    public boolean checkServerStatus() {
        try (CloseableHttpClient client = httpClientFactory.createHttpClient();
             CloseableHttpResponse response = client.execute(new HttpHead(baseUrl))) {
            log.debug("服务器状态探测: {} -> {}", baseUrl, response.getStatusLine().getStatusCode());
            return true;
        } catch (Exception e) {
            log.debug("服务器不可达: {}", baseUrl, e);
            return false;
        }
    }

    public String metadataUrl(String cleanedTitleId) {
        return baseUrl + "/tpl/np/" + cleanedTitleId + "/" + cleanedTitleId + "-ver.xml";
    }

    /**
     * 查询指定游戏的更新包
     *
     * @param rawTitleId 用户输入的 Title ID，允许小写、空格和 -
     * @return 查询结果，没有 package 条目时 results 为空且 error 为 null
     * @throws com.example.ps3update.exception.InvalidTitleIdException Title ID 非法
     * @throws NoUpdatesFoundException 服务器返回非 2xx 或空响应
     * @throws com.example.ps3update.exception.XmlParseException XML 格式错误
     * @throws NetworkException 网络错误或超时
     */
    public FetchResult fetchUpdates(String rawTitleId) {
        String titleId = FormatUtils.cleanTitleId(rawTitleId);
        String url = metadataUrl(titleId);
        log.info("查询更新: {} ({})", titleId, url);

        String body = fetchMetadata(titleId, url);
        UpdateXmlParser.ParsedDocument document = parser.parse(body);

        List<PackageInfo> packages = new ArrayList<>(document.getPackages());
        packages.sort(NEWEST_FIRST);
        log.info("{} [{}] 共找到 {} 个更新包", titleId, document.getGameTitle(), packages.size());

        return FetchResult.builder()
                .gameTitle(document.getGameTitle())
                .cleanedTitleId(titleId)
                .results(packages)
                .build();
    }

    private String fetchMetadata(String titleId, String url) {
        try (CloseableHttpClient client = httpClientFactory.createHttpClient();
             CloseableHttpResponse response = client.execute(new HttpGet(url))) {
            int code = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            if (code < 200 || code >= 300) {
                log.info("{} 没有更新信息, HTTP {}", titleId, code);
                throw new NoUpdatesFoundException(titleId);
            }
            if (body.trim().isEmpty()) {
                log.info("{} 更新信息为空", titleId);
                throw new NoUpdatesFoundException(titleId);
            }
            return body;
        } catch (IOException e) {
            log.warn("请求更新信息失败: {}", url, e);
            throw new NetworkException(e.getMessage(), e);
        }
    }
}
