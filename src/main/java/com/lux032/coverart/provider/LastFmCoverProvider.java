package com.lux032.coverart.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.ProviderName;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last.fm track.getInfo 封面来源
 * 专辑图片按尺寸从小到大排列，取最后几张（最大的）。未配置 API Key 时不启用。
 */
@Slf4j
public class LastFmCoverProvider extends AbstractHttpProvider {

    public LastFmCoverProvider(CoverArtConfig config) {
        super(config);
    }

    @Override
    public ProviderName getName() {
        return ProviderName.LASTFM;
    }

    @Override
    public boolean isEnabled() {
        return config.isLastFmUsable();
    }

    @Override
    protected List<RawImage> doFetch(String artist, String title, int limit) throws IOException {
        if (artist.isEmpty() || title.isEmpty()) {
            // track.getInfo 需要同时提供艺术家和曲名
            return new ArrayList<>();
        }

        String url = String.format("%s?method=track.getInfo&artist=%s&track=%s&api_key=%s&format=json",
            config.getLastFmApiUrl(), encode(artist), encode(title), encode(config.getLastFmApiKey().trim()));

        Optional<TrackInfoResponse> response = getJson(url, TrackInfoResponse.class);
        if (response.isEmpty()) {
            return new ArrayList<>();
        }
        if (response.get().getError() != null) {
            log.debug("Last.fm 返回错误 {}: {}", response.get().getError(), response.get().getMessage());
            return new ArrayList<>();
        }

        Track track = response.get().getTrack();
        if (track == null || track.getAlbum() == null || track.getAlbum().getImage() == null) {
            return new ArrayList<>();
        }

        List<String> imageUrls = new ArrayList<>();
        for (AlbumImage image : track.getAlbum().getImage()) {
            if (image != null && image.getUrl() != null && !image.getUrl().isEmpty()) {
                imageUrls.add(image.getUrl());
            }
        }

        List<RawImage> images = new ArrayList<>();
        int start = Math.max(0, imageUrls.size() - limit);
        for (String imageUrl : imageUrls.subList(start, imageUrls.size())) {
            download(imageUrl).ifPresent(images::add);
        }
        return images;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TrackInfoResponse {
        private Track track;
        private Integer error;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Track {
        private String name;
        private Album album;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Album {
        private String title;
        private List<AlbumImage> image;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AlbumImage {
        @JsonProperty("#text")
        private String url;
        private String size;
    }
}
