package com.lux032.coverart.service;

import com.lux032.coverart.ImageFixtures;
import com.lux032.coverart.model.CoverArtCandidate;
import com.lux032.coverart.model.Fingerprint;
import com.lux032.coverart.model.ProviderName;
import com.lux032.coverart.model.TrackQuery;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TagWriterServiceTest {

    // MPEG-1 Layer III, 128 kbps, 44.1 kHz, joint stereo
    private static final byte[] MP3_FRAME_HEADER = {(byte) 0xFF, (byte) 0xFB, (byte) 0x90, (byte) 0x64};
    private static final int MP3_FRAME_LENGTH = 417;
    private static final int MP3_FRAME_COUNT = 40;

    private final TagWriterService tagWriterService = new TagWriterService();

    @Test
    void should_ReadArtistAndTitleFromTag(@TempDir Path dir) throws Exception {
        Path mp3 = taggedMp3(dir, "Daft Punk", "One More Time");

        Optional<TrackQuery> query = tagWriterService.readTrackQuery(mp3.toFile());

        assertThat(query).isPresent();
        assertThat(query.get().getArtist()).isEqualTo("Daft Punk");
        assertThat(query.get().getTitle()).isEqualTo("One More Time");
    }

    @Test
    void should_EmbedCoverArtAsPng_AndKeepExistingTags(@TempDir Path dir) throws Exception {
        Path mp3 = taggedMp3(dir, "Daft Punk", "One More Time");
        byte[] png = ImageFixtures.solidPng(Color.RED, 32, 32);

        assertThat(tagWriterService.embedCoverArt(mp3.toFile(), png)).isTrue();

        Tag tag = AudioFileIO.read(mp3.toFile()).getTag();
        Artwork artwork = tag.getFirstArtwork();
        assertThat(artwork).isNotNull();
        assertThat(artwork.getBinaryData()).isEqualTo(png);
        assertThat(artwork.getMimeType()).isEqualTo("image/png");
        assertThat(tag.getFirst(FieldKey.ARTIST)).isEqualTo("Daft Punk");
    }

    @Test
    void should_ReplaceExistingArtwork_When_EmbeddingAgain(@TempDir Path dir) throws Exception {
        Path mp3 = taggedMp3(dir, "Artist", "Title");
        byte[] first = ImageFixtures.solidPng(Color.RED, 16, 16);
        byte[] second = ImageFixtures.jpeg(ImageFixtures.solid(Color.BLUE, 16, 16));

        assertThat(tagWriterService.embedCoverArt(mp3.toFile(), first)).isTrue();
        assertThat(tagWriterService.embedCoverArt(mp3.toFile(), second)).isTrue();

        Tag tag = AudioFileIO.read(mp3.toFile()).getTag();
        assertThat(tag.getArtworkList()).hasSize(1);
        assertThat(tag.getFirstArtwork().getBinaryData()).isEqualTo(second);
        assertThat(tag.getFirstArtwork().getMimeType()).isEqualTo("image/jpeg");
    }

    @Test
    void should_SaveCoverArt_CreatingParentDirectories(@TempDir Path dir) throws IOException {
        byte[] png = ImageFixtures.solidPng(Color.RED, 16, 16);
        CoverArtCandidate candidate = new CoverArtCandidate("https://example.com/c.png", ProviderName.ITUNES,
            png, 16, 16, Fingerprint.EMPTY);
        Path output = dir.resolve("covers/artist/cover.png");

        assertThat(tagWriterService.saveCoverArt(candidate, output)).isTrue();
        assertThat(Files.readAllBytes(output)).isEqualTo(png);
    }

    @Test
    void should_NotSave_When_CandidateIsMissing(@TempDir Path dir) {
        assertThat(tagWriterService.saveCoverArt(null, dir.resolve("cover.jpg"))).isFalse();
    }

    @Test
    void should_ReturnEmptyQuery_When_FileDoesNotExist(@TempDir Path dir) {
        assertThat(tagWriterService.readTrackQuery(dir.resolve("missing.mp3").toFile())).isEmpty();
    }

    @Test
    void should_ReturnEmptyQuery_When_FileIsNotAudio(@TempDir Path dir) throws IOException {
        Path notAudio = dir.resolve("notes.mp3");
        Files.write(notAudio, "just some text".getBytes(StandardCharsets.UTF_8));

        assertThat(tagWriterService.readTrackQuery(notAudio.toFile())).isEmpty();
    }

    @Test
    void should_NotEmbed_When_CoverDataIsEmpty(@TempDir Path dir) throws IOException {
        Path audio = dir.resolve("track.mp3");
        Files.write(audio, new byte[]{1, 2, 3});

        assertThat(tagWriterService.embedCoverArt(audio.toFile(), new byte[0])).isFalse();
        assertThat(tagWriterService.embedCoverArt(audio.toFile(), null)).isFalse();
    }

    @Test
    void should_ReportFailure_When_EmbeddingIntoNonAudioFile(@TempDir Path dir) throws IOException {
        Path notAudio = dir.resolve("notes.flac");
        Files.write(notAudio, "not flac".getBytes(StandardCharsets.UTF_8));

        assertThat(tagWriterService.embedCoverArt(notAudio.toFile(), ImageFixtures.solidPng(Color.RED, 4, 4))).isFalse();
    }

    /**
     * 生成只含静音帧的 MP3，并写入艺术家和标题
     */
    private static Path taggedMp3(Path dir, String artist, String title) throws Exception {
        byte[] data = new byte[MP3_FRAME_LENGTH * MP3_FRAME_COUNT];
        for (int i = 0; i < MP3_FRAME_COUNT; i++) {
            System.arraycopy(MP3_FRAME_HEADER, 0, data, i * MP3_FRAME_LENGTH, MP3_FRAME_HEADER.length);
        }
        Path mp3 = dir.resolve("track.mp3");
        Files.write(mp3, data);

        AudioFile audio = AudioFileIO.read(mp3.toFile());
        Tag tag = audio.getTagOrCreateAndSetDefault();
        tag.setField(FieldKey.ARTIST, artist);
        tag.setField(FieldKey.TITLE, title);
        audio.commit();
        return mp3;
    }
}
