package com.lux032.coverart.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 封面获取配置类
 * 默认值写在构造函数里，config.properties 中出现的键覆盖默认值
 */
@Slf4j
@Data
public class CoverArtConfig {

    public static final String DEFAULT_CONFIG_FILE = "config.properties";

    // 通用配置
    private String language;
    private String userAgent;
    private int httpTimeoutSeconds;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // MusicBrainz / Cover Art Archive
    private boolean musicBrainzEnabled;
    private String musicBrainzApiUrl;
    private String coverArtApiUrl;

    // iTunes Search API
    private boolean itunesEnabled;
    private String itunesApiUrl;

    // Last.fm (需要 API Key，未配置时自动禁用)
    private boolean lastFmEnabled;
    private String lastFmApiUrl;
    private String lastFmApiKey;

    // 获取流程配置
    private int maxCandidates;
    private boolean parallelFetch;
    private long courtesyDelayMs;
    private int providerTimeoutSeconds;

    // 图片与相似度配置
    private long maxImageBytes;
    private double similarityThreshold;

    private static CoverArtConfig instance;

    public CoverArtConfig() {
        this.language = "en_US";
        this.userAgent = "CoverArtConsensus/1.0 ( contact@example.com )";
        this.httpTimeoutSeconds = 10;

        this.proxyEnabled = false;
        this.proxyPort = 0;

        this.musicBrainzEnabled = true;
        this.musicBrainzApiUrl = "https://musicbrainz.org/ws/2";
        this.coverArtApiUrl = "https://coverartarchive.org";

        this.itunesEnabled = true;
        this.itunesApiUrl = "https://itunes.apple.com";

        this.lastFmEnabled = true;
        this.lastFmApiUrl = "https://ws.audioscrobbler.com/2.0/";
        this.lastFmApiKey = "";

        this.maxCandidates = 12;
        this.parallelFetch = true;
        this.courtesyDelayMs = 500;
        this.providerTimeoutSeconds = 30;

        this.maxImageBytes = 500_000;
        this.similarityThreshold = 0.85;
    }

    /**
     * 获取配置单例（首次调用时从工作目录的 config.properties 加载）
     */
    public static synchronized CoverArtConfig getInstance() {
        if (instance == null) {
            instance = new CoverArtConfig();
            instance.loadFromFile(DEFAULT_CONFIG_FILE);
        }
        return instance;
    }

    /**
     * 从配置文件加载配置
     * @return 文件存在且读取成功时返回 true
     */
    public boolean loadFromFile(String path) {
        Properties props = new Properties();
        try (InputStreamReader reader = new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.info("未找到配置文件 {}，使用默认配置", path);
            return false;
        }

        applyProperties(props);
        log.info("配置文件加载成功: {}", path);
        if (proxyEnabled) {
            log.info("HTTP 代理已启用: {}:{}", proxyHost, proxyPort);
        }
        return true;
    }

    /**
     * 应用配置项，未出现的键保留当前值
     */
    public void applyProperties(Properties props) {
        language = props.getProperty("language", language);
        userAgent = props.getProperty("http.userAgent", userAgent);
        httpTimeoutSeconds = parseInt(props, "http.timeoutSeconds", httpTimeoutSeconds);

        proxyEnabled = parseBoolean(props, "proxy.enabled", proxyEnabled);
        proxyHost = props.getProperty("proxy.host", proxyHost);
        proxyPort = parseInt(props, "proxy.port", proxyPort);

        musicBrainzEnabled = parseBoolean(props, "provider.musicbrainz.enabled", musicBrainzEnabled);
        musicBrainzApiUrl = props.getProperty("provider.musicbrainz.apiUrl", musicBrainzApiUrl);
        coverArtApiUrl = props.getProperty("provider.musicbrainz.coverArtApiUrl", coverArtApiUrl);

        itunesEnabled = parseBoolean(props, "provider.itunes.enabled", itunesEnabled);
        itunesApiUrl = props.getProperty("provider.itunes.apiUrl", itunesApiUrl);

        lastFmEnabled = parseBoolean(props, "provider.lastfm.enabled", lastFmEnabled);
        lastFmApiUrl = props.getProperty("provider.lastfm.apiUrl", lastFmApiUrl);
        lastFmApiKey = props.getProperty("provider.lastfm.apiKey", lastFmApiKey);

        maxCandidates = parseInt(props, "fetch.maxCandidates", maxCandidates);
        parallelFetch = parseBoolean(props, "fetch.parallel", parallelFetch);
        courtesyDelayMs = parseLong(props, "fetch.courtesyDelayMs", courtesyDelayMs);
        providerTimeoutSeconds = parseInt(props, "fetch.providerTimeoutSeconds", providerTimeoutSeconds);

        maxImageBytes = parseLong(props, "image.maxBytes", maxImageBytes);
        similarityThreshold = parseDouble(props, "consensus.similarityThreshold", similarityThreshold);
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            log.error("相似度阈值必须在 0 到 1 之间: {}", similarityThreshold);
            return false;
        }
        if (maxImageBytes <= 0) {
            log.error("图片大小上限必须为正数: {}", maxImageBytes);
            return false;
        }
        if (httpTimeoutSeconds <= 0 || providerTimeoutSeconds <= 0) {
            log.error("超时时间必须为正数: http={}s, provider={}s", httpTimeoutSeconds, providerTimeoutSeconds);
            return false;
        }
        if (maxCandidates <= 0) {
            log.error("候选图片数量必须为正数: {}", maxCandidates);
            return false;
        }
        if (courtesyDelayMs < 0) {
            log.error("请求间隔不能为负数: {}", courtesyDelayMs);
            return false;
        }
        return true;
    }

    /**
     * Last.fm 只有在启用且配置了 API Key 时才会真正发请求
     */
    public boolean isLastFmUsable() {
        return lastFmEnabled && lastFmApiKey != null && !lastFmApiKey.trim().isEmpty();
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 格式错误: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 格式错误: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 格式错误: {}，使用默认值 {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
