package com.lux032.coverart.model;

import lombok.Data;

/**
 * 封面查询条件（从音频标签读取）
 */
@Data
public class TrackQuery {
    private final String artist;
    private final String title;

    public TrackQuery(String artist, String title) {
        this.artist = artist == null ? "" : artist.trim();
        this.title = title == null ? "" : title.trim();
    }

    public boolean isEmpty() {
        return artist.isEmpty() && title.isEmpty();
    }
}
