package com.lux032.coverart.provider;

import com.lux032.coverart.ImageFixtures;
import com.lux032.coverart.config.CoverArtConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MusicBrainzCoverProviderTest {

    private static final String SEARCH_PATH = "/ws/2/recording";

    private StubHttpServer server;
    private MusicBrainzCoverProvider provider;
    private byte[] front;
    private byte[] back;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
        CoverArtConfig config = new CoverArtConfig();
        config.setMusicBrainzApiUrl(server.baseUrl() + "/ws/2");
        config.setCoverArtApiUrl(server.baseUrl() + "/caa");
        config.setHttpTimeoutSeconds(2);
        provider = new MusicBrainzCoverProvider(config);

        front = ImageFixtures.solidPng(Color.RED, 20, 20);
        back = ImageFixtures.solidPng(Color.GREEN, 20, 20);
    }

    @AfterEach
    void tearDown() throws Exception {
        provider.close();
        server.close();
    }

    @Test
    void should_ReturnFrontCoverFirst() {
        server.json(SEARCH_PATH, searchResponse("rel-1"))
            .json("/caa/release/rel-1", "{\"images\":["
                + "{\"image\":\"" + server.baseUrl() + "/img/back.png\",\"front\":false},"
                + "{\"image\":\"" + server.baseUrl() + "/img/front.png\",\"front\":true}]}")
            .image("/img/front.png", front)
            .image("/img/back.png", back);

        List<RawImage> images = provider.fetchCandidateImages("Artist", "Title", 4);

        assertThat(images).hasSize(2);
        assertThat(images.get(0).getUrl()).endsWith("/img/front.png");
        assertThat(images.get(0).getBytes()).isEqualTo(front);
        assertThat(images.get(1).getUrl()).endsWith("/img/back.png");
    }

    @Test
    void should_SendLuceneQueryWithJsonFormat() {
        server.json(SEARCH_PATH, "{\"recordings\":[]}");

        provider.fetchCandidateImages("Daft Punk", "One More Time", 3);

        assertThat(server.requests()).hasSize(1);
        String request = server.requests().get(0);
        assertThat(request).startsWith(SEARCH_PATH + "?query=");
        assertThat(request).contains("fmt=json").contains("limit=5");
        assertThat(URLDecoder.decode(request, StandardCharsets.UTF_8))
            .contains("recording:\"One More Time\" AND artist:\"Daft Punk\"");
    }

    @Test
    void should_UseOnlyFirstTwoRecordings_AndSkipReleaseWithoutCoverArt() {
        server.json(SEARCH_PATH, searchResponse("rel-1", "rel-2", "rel-3"))
            // rel-1 在 Cover Art Archive 中不存在 (404)
            .json("/caa/release/rel-2", "{\"images\":[{\"image\":\"" + server.baseUrl() + "/img/front.png\",\"front\":true}]}")
            .json("/caa/release/rel-3", "{\"images\":[{\"image\":\"" + server.baseUrl() + "/img/back.png\",\"front\":true}]}")
            .image("/img/front.png", front)
            .image("/img/back.png", back);

        List<RawImage> images = provider.fetchCandidateImages("Artist", "Title", 4);

        assertThat(images).extracting(RawImage::getUrl).containsExactly(server.baseUrl() + "/img/front.png");
        assertThat(server.requestCount("/caa/release/rel-1")).isEqualTo(1);
        assertThat(server.requestCount("/caa/release/rel-3")).isZero();
    }

    @Test
    void should_RespectLimit() {
        server.json(SEARCH_PATH, searchResponse("rel-1"))
            .json("/caa/release/rel-1", "{\"images\":["
                + "{\"image\":\"" + server.baseUrl() + "/img/front.png\",\"front\":true},"
                + "{\"image\":\"" + server.baseUrl() + "/img/back.png\",\"front\":false}]}")
            .image("/img/front.png", front)
            .image("/img/back.png", back);

        List<RawImage> images = provider.fetchCandidateImages("Artist", "Title", 1);

        assertThat(images).hasSize(1);
        assertThat(server.requestCount("/img/back.png")).isZero();
    }

    @Test
    void should_SkipResponsesThatAreNotImages() {
        server.json(SEARCH_PATH, searchResponse("rel-1"))
            .json("/caa/release/rel-1", "{\"images\":["
                + "{\"image\":\"" + server.baseUrl() + "/img/error\",\"front\":true},"
                + "{\"image\":\"" + server.baseUrl() + "/img/back.png\",\"front\":false}]}")
            .respond("/img/error", new StubHttpServer.StubResponse(200, "text/html",
                "<html>error</html>".getBytes(StandardCharsets.UTF_8), 0))
            .image("/img/back.png", back);

        List<RawImage> images = provider.fetchCandidateImages("Artist", "Title", 4);

        assertThat(images).extracting(RawImage::getUrl).containsExactly(server.baseUrl() + "/img/back.png");
    }

    @Test
    void should_ReturnEmpty_When_SearchFails() {
        server.respond(SEARCH_PATH, StubHttpServer.StubResponse.status(500));

        assertThat(provider.fetchCandidateImages("Artist", "Title", 4)).isEmpty();
    }

    @Test
    void should_ReturnEmpty_When_SearchReturnsMalformedJson() {
        server.json(SEARCH_PATH, "{\"recordings\": [ not json");

        assertThat(provider.fetchCandidateImages("Artist", "Title", 4)).isEmpty();
    }

    @Test
    void should_NotSendRequest_When_QueryIsBlank() {
        assertThat(provider.fetchCandidateImages("", " ", 4)).isEmpty();
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void should_BuildQueryFromNonEmptyFieldsAndEscapeQuotes() {
        assertThat(MusicBrainzCoverProvider.buildQuery("", "Song")).isEqualTo("recording:\"Song\"");
        assertThat(MusicBrainzCoverProvider.buildQuery("Band", "")).isEqualTo("artist:\"Band\"");
        assertThat(MusicBrainzCoverProvider.buildQuery("A \"B\"", "C\\D"))
            .isEqualTo("recording:\"C\\\\D\" AND artist:\"A \\\"B\\\"\"");
    }

    private static String searchResponse(String... releaseIds) {
        StringBuilder json = new StringBuilder("{\"recordings\":[");
        for (int i = 0; i < releaseIds.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"id\":\"rec-").append(i).append("\",\"title\":\"Title\",\"releases\":[{\"id\":\"")
                .append(releaseIds[i]).append("\",\"title\":\"Album\"}]}");
        }
        return json.append("]}").toString();
    }
}
