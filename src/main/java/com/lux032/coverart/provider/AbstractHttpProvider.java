package com.lux032.coverart.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.ProviderName;
import com.lux032.coverart.service.ImageCompressor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基于 HttpClient 的封面来源基类
 * 负责超时/代理配置、JSON 请求与图片下载，以及把所有失败降级为空结果
 */
@Slf4j
public abstract class AbstractHttpProvider implements CoverArtProvider {

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    protected final CoverArtConfig config;
    protected final CloseableHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpProvider(CoverArtConfig config) {
        this.config = config;
        this.httpClient = createHttpClient(config);
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    private CloseableHttpClient createHttpClient(CoverArtConfig config) {
        Timeout timeout = Timeout.ofSeconds(config.getHttpTimeoutSeconds());

        HttpClientBuilder builder = HttpClients.custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(timeout)
                    .setSocketTimeout(timeout)
                    .build())
                .build())
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build());

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.debug("{} 使用代理: {}:{}", getClass().getSimpleName(), config.getProxyHost(), config.getProxyPort());
        } else if (config.isProxyEnabled()) {
            log.warn("代理已启用但未配置代理地址，直接连接");
        }

        return builder.build();
    }

    @Override
    public final List<RawImage> fetchCandidateImages(String artist, String title, int limit) {
        if (!isEnabled() || limit <= 0) {
            return Collections.emptyList();
        }
        String safeArtist = artist == null ? "" : artist.trim();
        String safeTitle = title == null ? "" : title.trim();
        if (safeArtist.isEmpty() && safeTitle.isEmpty()) {
            return Collections.emptyList();
        }

        try {
            List<RawImage> images = doFetch(safeArtist, safeTitle, limit);
            return images.size() > limit ? new ArrayList<>(images.subList(0, limit)) : images;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} 请求被中断", getName());
        } catch (IOException | RuntimeException e) {
            log.warn("从 {} 获取封面失败: {}", getName(), e.toString());
        }
        return Collections.emptyList();
    }

    /**
     * 具体的查询流程
     * 抛出的任何异常都会被视为该来源没有结果
     */
    protected abstract List<RawImage> doFetch(String artist, String title, int limit)
        throws IOException, InterruptedException;

    /**
     * 请求 JSON 并映射为指定类型
     * @return 非 2xx 状态时返回 empty；响应体无法解析时抛出 IOException
     */
    protected <T> Optional<T> getJson(String url, Class<T> type) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("User-Agent", config.getUserAgent());
        httpGet.setHeader("Accept", "application/json");

        log.debug("{} 请求: {}", getName(), url);
        byte[] body = httpClient.execute(httpGet, response -> {
            int statusCode = response.getCode();
            if (statusCode == HTTP_TOO_MANY_REQUESTS) {
                log.warn("{} 触发速率限制: {}", getName(), url);
                return null;
            }
            if (statusCode < 200 || statusCode >= 300) {
                log.debug("{} 返回状态码 {}: {}", getName(), statusCode, url);
                return null;
            }
            HttpEntity entity = response.getEntity();
            return entity == null ? null : EntityUtils.toByteArray(entity);
        });

        if (body == null || body.length == 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.readValue(body, type));
    }

    /**
     * 下载单张图片
     * 单张失败只跳过这一张，不影响同一来源的其他图片
     */
    protected Optional<RawImage> download(String url) {
        if (url == null || url.trim().isEmpty()) {
            return Optional.empty();
        }

        try {
            HttpGet httpGet = new HttpGet(url);
            httpGet.setHeader("User-Agent", config.getUserAgent());

            return httpClient.execute(httpGet, response -> {
                if (response.getCode() < 200 || response.getCode() >= 300) {
                    log.debug("下载图片返回状态码 {}: {}", response.getCode(), url);
                    return Optional.<RawImage>empty();
                }
                HttpEntity entity = response.getEntity();
                if (entity == null) {
                    return Optional.<RawImage>empty();
                }
                String contentType = entity.getContentType();
                if (!ImageCompressor.looksLikeImage(contentType, url)) {
                    log.debug("响应不是图片 (Content-Type: {}): {}", contentType, url);
                    EntityUtils.consume(entity);
                    return Optional.<RawImage>empty();
                }
                byte[] data = EntityUtils.toByteArray(entity);
                log.debug("已下载 {} 图片: {} 字节", getName(), data.length);
                return Optional.of(new RawImage(url, data));
            });
        } catch (IOException | RuntimeException e) {
            log.debug("下载图片失败 {}: {}", url, e.toString());
            return Optional.empty();
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    @Override
    public String toString() {
        ProviderName name = getName();
        return getClass().getSimpleName() + "{" + name + ", enabled=" + isEnabled() + "}";
    }
}
