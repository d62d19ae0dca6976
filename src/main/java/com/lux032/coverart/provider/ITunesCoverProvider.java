package com.lux032.coverart.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.ProviderName;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * iTunes Search API 封面来源（无需认证）
 */
@Slf4j
public class ITunesCoverProvider extends AbstractHttpProvider {

    public ITunesCoverProvider(CoverArtConfig config) {
        super(config);
    }

    @Override
    public ProviderName getName() {
        return ProviderName.ITUNES;
    }

    @Override
    public boolean isEnabled() {
        return config.isItunesEnabled();
    }

    @Override
    protected List<RawImage> doFetch(String artist, String title, int limit) throws IOException {
        String term = (artist + " " + title).trim();
        String url = String.format("%s/search?term=%s&media=music&entity=song&limit=%d",
            config.getItunesApiUrl(), encode(term), limit);

        Optional<SearchResponse> response = getJson(url, SearchResponse.class);
        if (response.isEmpty() || response.get().getResults() == null) {
            log.debug("iTunes 没有找到结果: {}", term);
            return new ArrayList<>();
        }

        // 同一首歌常出现在多张专辑里，封面地址去重
        Set<String> artworkUrls = new LinkedHashSet<>();
        for (SearchResult result : response.get().getResults()) {
            String artworkUrl = result.getArtworkUrl600();
            if (artworkUrl == null || artworkUrl.isEmpty()) {
                artworkUrl = result.getArtworkUrl100();
            }
            if (artworkUrl != null && !artworkUrl.isEmpty()) {
                artworkUrls.add(artworkUrl);
            }
        }

        List<RawImage> images = new ArrayList<>();
        for (String artworkUrl : artworkUrls) {
            if (images.size() >= limit) {
                break;
            }
            download(artworkUrl).ifPresent(images::add);
        }
        return images;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResponse {
        private int resultCount;
        private List<SearchResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResult {
        private String artistName;
        private String trackName;
        private String collectionName;
        private String artworkUrl100;
        private String artworkUrl600;
    }
}
