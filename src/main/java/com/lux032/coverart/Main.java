package com.lux032.coverart;

import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.CoverArtCandidate;
import com.lux032.coverart.model.TrackQuery;
import com.lux032.coverart.service.CoverArtFetcher;
import com.lux032.coverart.service.TagWriterService;
import com.lux032.coverart.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * 封面获取命令行入口
 * 用法:
 *   Main &lt;艺术家&gt; &lt;标题&gt; [输出文件]
 *   Main --file &lt;音频文件&gt;   从标签读取艺术家/标题，并把封面写回音频文件
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        CoverArtConfig config = CoverArtConfig.getInstance();
        I18nUtil.init(config.getLanguage());

        if (!config.isValid()) {
            log.error(I18nUtil.getMessage("app.config.invalid"));
            System.exit(2);
            return;
        }

        if (args.length < 2) {
            System.out.println(I18nUtil.getMessage("app.usage"));
            System.exit(1);
            return;
        }

        TagWriterService tagWriter = new TagWriterService();
        File audioFile = null;
        String artist;
        String title;
        String outputFile = null;

        if ("--file".equals(args[0])) {
            audioFile = new File(args[1]);
            Optional<TrackQuery> query = tagWriter.readTrackQuery(audioFile);
            if (query.isEmpty()) {
                System.out.println(I18nUtil.getMessage("app.result.none"));
                System.exit(1);
                return;
            }
            artist = query.get().getArtist();
            title = query.get().getTitle();
        } else {
            artist = args[0];
            title = args[1];
            if (args.length > 2) {
                outputFile = args[2];
            }
        }

        try (CoverArtFetcher fetcher = new CoverArtFetcher(config)) {
            Optional<CoverArtCandidate> best = fetcher.fetchCoverArt(artist, title);

            if (best.isEmpty()) {
                System.out.println(I18nUtil.getMessage("app.result.none"));
                return;
            }

            CoverArtCandidate candidate = best.get();
            System.out.println(I18nUtil.getMessage("app.result.found"));
            System.out.printf("   Source: %s%n", candidate.getProviderName());
            System.out.printf("   Resolution: %dx%d%n", candidate.getWidth(), candidate.getHeight());
            System.out.printf("   Size: %.1fKB%n", candidate.getSizeBytes() / 1024.0);
            System.out.printf("   Similarity score: %.1f%%%n", candidate.getSimilarityScore() * 100);
            System.out.printf("   URL: %s%n", candidate.getSourceUrl());

            if (outputFile != null && tagWriter.saveCoverArt(candidate, Paths.get(outputFile))) {
                System.out.println(I18nUtil.getMessage("app.saved", outputFile));
            }
            if (audioFile != null && tagWriter.embedCoverArt(audioFile, candidate.getImageBytes())) {
                System.out.println(I18nUtil.getMessage("app.embedded", audioFile.getName()));
            }
        }
    }
}
