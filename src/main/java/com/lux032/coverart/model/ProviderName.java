package com.lux032.coverart.model;

/**
 * 封面来源
 * 声明顺序即合并候选时的优先级顺序
 */
public enum ProviderName {

    MUSICBRAINZ("musicbrainz"),

    ITUNES("itunes"),

    LASTFM("lastfm");

    private final String id;

    ProviderName(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
