package com.lux032.coverart.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.ProviderName;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MusicBrainz + Cover Art Archive 封面来源
 * 先按艺术家/标题搜索录音，取前两条录音的第一个 Release，再到 Cover Art Archive 下载图片
 */
@Slf4j
public class MusicBrainzCoverProvider extends AbstractHttpProvider {

    static final int SEARCH_LIMIT = 5;
    static final int MAX_RECORDINGS = 2;
    private static final long REQUEST_INTERVAL = 1000; // MusicBrainz 要求至少1秒间隔

    private long lastRequestTime = 0;

    public MusicBrainzCoverProvider(CoverArtConfig config) {
        super(config);
    }

    @Override
    public ProviderName getName() {
        return ProviderName.MUSICBRAINZ;
    }

    @Override
    public boolean isEnabled() {
        return config.isMusicBrainzEnabled();
    }

    @Override
    protected List<RawImage> doFetch(String artist, String title, int limit) throws IOException, InterruptedException {
        rateLimit();

        String url = String.format("%s/recording?query=%s&fmt=json&limit=%d",
            config.getMusicBrainzApiUrl(), encode(buildQuery(artist, title)), SEARCH_LIMIT);

        Optional<RecordingSearchResponse> search = getJson(url, RecordingSearchResponse.class);
        if (search.isEmpty() || search.get().getRecordings() == null) {
            log.debug("MusicBrainz 没有找到录音: {} - {}", artist, title);
            return new ArrayList<>();
        }

        Set<String> releaseIds = new LinkedHashSet<>();
        List<Recording> recordings = search.get().getRecordings();
        for (int i = 0; i < recordings.size() && i < MAX_RECORDINGS; i++) {
            Recording recording = recordings.get(i);
            if (recording == null || recording.getReleases() == null || recording.getReleases().isEmpty()) {
                continue;
            }
            Release release = recording.getReleases().get(0);
            if (release != null && release.getId() != null && !release.getId().isEmpty()) {
                releaseIds.add(release.getId());
            }
        }

        List<RawImage> images = new ArrayList<>();
        for (String releaseId : releaseIds) {
            if (images.size() >= limit) {
                break;
            }
            for (String imageUrl : getCoverArtUrls(releaseId)) {
                if (images.size() >= limit) {
                    break;
                }
                download(imageUrl).ifPresent(images::add);
            }
        }

        log.debug("MusicBrainz 获取到 {} 张图片 ({} 个 Release)", images.size(), releaseIds.size());
        return images;
    }

    /**
     * 查询 Cover Art Archive，正面封面排在前面
     * 某个 Release 没有封面(404)或请求失败时返回空列表，继续下一个 Release
     */
    private List<String> getCoverArtUrls(String releaseId) {
        List<String> urls = new ArrayList<>();
        try {
            String url = String.format("%s/release/%s", config.getCoverArtApiUrl(), releaseId);
            Optional<CoverArtArchiveResponse> response = getJson(url, CoverArtArchiveResponse.class);
            if (response.isEmpty() || response.get().getImages() == null) {
                return urls;
            }

            List<CoverArtImage> images = new ArrayList<>(response.get().getImages());
            images.sort(Comparator.comparing(image -> !image.isFront()));
            for (CoverArtImage image : images) {
                if (image.getImage() != null && !image.getImage().isEmpty()) {
                    urls.add(image.getImage());
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("获取 Cover Art Archive 封面列表失败 (Release: {}): {}", releaseId, e.toString());
        }
        return urls;
    }

    /**
     * 构建 Lucene 查询，只包含非空字段
     */
    static String buildQuery(String artist, String title) {
        StringBuilder query = new StringBuilder();
        if (!title.isEmpty()) {
            query.append("recording:\"").append(escape(title)).append("\"");
        }
        if (!artist.isEmpty()) {
            if (query.length() > 0) {
                query.append(" AND ");
            }
            query.append("artist:\"").append(escape(artist)).append("\"");
        }
        return query.toString();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private synchronized void rateLimit() throws InterruptedException {
        long currentTime = System.currentTimeMillis();
        long timeSinceLastRequest = currentTime - lastRequestTime;

        if (timeSinceLastRequest < REQUEST_INTERVAL) {
            long sleepTime = REQUEST_INTERVAL - timeSinceLastRequest;
            log.debug("等待 {} ms 以符合 API 速率限制", sleepTime);
            Thread.sleep(sleepTime);
        }

        lastRequestTime = System.currentTimeMillis();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RecordingSearchResponse {
        private List<Recording> recordings;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Recording {
        private String id;
        private String title;
        private List<Release> releases;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Release {
        private String id;
        private String title;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CoverArtArchiveResponse {
        private List<CoverArtImage> images;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CoverArtImage {
        private String image;
        private boolean front;
    }
}
