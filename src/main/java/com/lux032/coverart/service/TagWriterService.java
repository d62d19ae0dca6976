package com.lux032.coverart.service;

import com.lux032.coverart.model.CoverArtCandidate;
import com.lux032.coverart.model.TrackQuery;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.StandardArtwork;
import org.jaudiotagger.tag.reference.PictureTypes;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 封面写入服务
 * 从音频标签读取查询条件，把选中的封面保存为文件或写入音频文件（JAudioTagger）
 */
@Slf4j
public class TagWriterService {

    /**
     * 读取音频文件的艺术家和标题
     * @return 标签不存在、无法读取或两项都为空时返回 empty
     */
    public Optional<TrackQuery> readTrackQuery(File audioFile) {
        if (audioFile == null || !audioFile.isFile()) {
            log.error("音频文件不存在: {}", audioFile);
            return Optional.empty();
        }

        try {
            AudioFile audio = AudioFileIO.read(audioFile);
            Tag tag = audio.getTag();
            if (tag == null) {
                log.warn("音频文件没有标签: {}", audioFile.getName());
                return Optional.empty();
            }

            TrackQuery query = new TrackQuery(tag.getFirst(FieldKey.ARTIST), tag.getFirst(FieldKey.TITLE));
            return query.isEmpty() ? Optional.empty() : Optional.of(query);
        } catch (Exception e) {
            log.error("读取音频标签失败: {}", audioFile.getName(), e);
            return Optional.empty();
        }
    }

    /**
     * 将封面写入音频文件（替换已有封面）
     */
    public boolean embedCoverArt(File audioFile, byte[] coverArtData) {
        if (coverArtData == null || coverArtData.length == 0) {
            return false;
        }

        try {
            AudioFile audio = AudioFileIO.read(audioFile);
            Tag tag = audio.getTagOrCreateAndSetDefault();

            Artwork artwork = new StandardArtwork();
            artwork.setBinaryData(coverArtData);
            artwork.setMimeType(ImageCompressor.detectMimeType(coverArtData));
            artwork.setPictureType(PictureTypes.DEFAULT_ID);

            tag.deleteArtworkField();
            tag.setField(artwork);
            audio.commit();

            log.info("封面已写入: {} ({} KB)", audioFile.getName(), coverArtData.length / 1024);
            return true;
        } catch (Exception e) {
            log.error("写入封面失败: {}", audioFile.getName(), e);
            return false;
        }
    }

    /**
     * 将选中的封面保存到文件
     */
    public boolean saveCoverArt(CoverArtCandidate candidate, Path outputPath) {
        if (candidate == null || outputPath == null) {
            return false;
        }

        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputPath, candidate.getImageBytes());
            log.info("封面已保存到: {}", outputPath);
            return true;
        } catch (IOException e) {
            log.error("保存封面失败: {}", outputPath, e);
            return false;
        }
    }
}
