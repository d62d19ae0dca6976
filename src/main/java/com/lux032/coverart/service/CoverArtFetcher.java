package com.lux032.coverart.service;

import com.lux032.coverart.config.CoverArtConfig;
import com.lux032.coverart.model.CoverArtCandidate;
import com.lux032.coverart.model.Fingerprint;
import com.lux032.coverart.provider.CoverArtProvider;
import com.lux032.coverart.provider.ITunesCoverProvider;
import com.lux032.coverart.provider.LastFmCoverProvider;
import com.lux032.coverart.provider.MusicBrainzCoverProvider;
import com.lux032.coverart.provider.RawImage;
import com.lux032.coverart.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 封面获取服务
 * 向所有来源请求图片，逐张校验/压缩/计算指纹后交给共识选择。
 *
 * <p>候选始终按来源优先级顺序合并，与请求完成的先后无关，保证分组和平局处理可复现。
 * 调用线程被中断时取消所有进行中的请求并返回 empty。
 */
@Slf4j
public class CoverArtFetcher implements Closeable {

    private final CoverArtConfig config;
    private final List<CoverArtProvider> providers;
    private final ImageCompressor imageCompressor;
    private final PerceptualHasher hasher;
    private final ConsensusSelector selector;
    private final ExecutorService providerExecutorService;

    public CoverArtFetcher(CoverArtConfig config) {
        this(config, createDefaultProviders(config), new ImageCompressor(), new PerceptualHasher(),
            new ConsensusSelector(new SimilarityMetric(), config.getSimilarityThreshold()));
    }

    /**
     * @param providers 按优先级排列的来源
     */
    public CoverArtFetcher(CoverArtConfig config, List<CoverArtProvider> providers,
                           ImageCompressor imageCompressor, PerceptualHasher hasher,
                           ConsensusSelector selector) {
        this.config = config;
        this.providers = Collections.unmodifiableList(new ArrayList<>(providers));
        this.imageCompressor = imageCompressor;
        this.hasher = hasher;
        this.selector = selector;
        this.providerExecutorService = Executors.newFixedThreadPool(
            Math.max(1, providers.size()), new ProviderThreadFactory());
    }

    /**
     * 默认来源，顺序即优先级
     */
    public static List<CoverArtProvider> createDefaultProviders(CoverArtConfig config) {
        List<CoverArtProvider> providers = new ArrayList<>();
        providers.add(new MusicBrainzCoverProvider(config));
        providers.add(new ITunesCoverProvider(config));
        providers.add(new LastFmCoverProvider(config));
        return providers;
    }

    /**
     * 使用配置中的候选数量获取封面
     */
    public Optional<CoverArtCandidate> fetchCoverArt(String artist, String title) {
        return fetchCoverArt(artist, title, config.getMaxCandidates());
    }

    /**
     * 获取封面
     * @param artist 艺术家
     * @param title 标题
     * @param maxCandidates 所有来源合计的候选数量上限（平均分配给启用的来源）
     * @return 最佳候选；没有找到或被取消时返回 empty
     */
    public Optional<CoverArtCandidate> fetchCoverArt(String artist, String title, int maxCandidates) {
        String safeArtist = artist == null ? "" : artist.trim();
        String safeTitle = title == null ? "" : title.trim();

        if (safeArtist.isEmpty() && safeTitle.isEmpty()) {
            log.info(I18nUtil.getMessage("fetch.empty.query"));
            return Optional.empty();
        }
        if (maxCandidates <= 0) {
            return Optional.empty();
        }

        log.info(I18nUtil.getMessage("fetch.start", safeArtist, safeTitle));

        List<CoverArtProvider> activeProviders = new ArrayList<>();
        for (CoverArtProvider provider : providers) {
            if (provider.isEnabled()) {
                activeProviders.add(provider);
            }
        }
        if (activeProviders.isEmpty()) {
            log.warn("没有启用的封面来源");
            return Optional.empty();
        }

        int perProvider = Math.max(1, maxCandidates / activeProviders.size());

        List<List<CoverArtCandidate>> results;
        try {
            results = config.isParallelFetch()
                ? fetchParallel(activeProviders, safeArtist, safeTitle, perProvider)
                : fetchSequential(activeProviders, safeArtist, safeTitle, perProvider);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info(I18nUtil.getMessage("fetch.cancelled"));
            return Optional.empty();
        }

        List<CoverArtCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < activeProviders.size(); i++) {
            List<CoverArtCandidate> sublist = results.get(i);
            log.info(I18nUtil.getMessage("fetch.provider.result", activeProviders.get(i).getName(), sublist.size()));
            candidates.addAll(sublist);
        }

        if (candidates.isEmpty()) {
            log.warn(I18nUtil.getMessage("fetch.no.candidates"));
            return Optional.empty();
        }

        log.info(I18nUtil.getMessage("fetch.candidates.found", candidates.size()));

        Optional<CoverArtCandidate> best = selector.selectBest(candidates);
        best.ifPresent(candidate -> log.info(I18nUtil.getMessage("fetch.selected",
            candidate.getProviderName(), candidate.getWidth(), candidate.getHeight(),
            candidate.getSizeBytes() / 1024, String.format("%.1f%%", candidate.getSimilarityScore() * 100))));
        return best;
    }

    /**
     * 并行请求所有来源，按来源顺序等待结果
     * 超过总超时的来源被取消并视为没有结果
     */
    private List<List<CoverArtCandidate>> fetchParallel(List<CoverArtProvider> activeProviders,
                                                        String artist, String title, int perProvider)
        throws InterruptedException {
        List<Future<List<CoverArtCandidate>>> futures = new ArrayList<>();
        for (CoverArtProvider provider : activeProviders) {
            futures.add(providerExecutorService.submit(() -> fetchFromProvider(provider, artist, title, perProvider)));
        }

        List<List<CoverArtCandidate>> results = new ArrayList<>();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getProviderTimeoutSeconds());
        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<List<CoverArtCandidate>> future = futures.get(i);
                long remaining = Math.max(0, deadline - System.nanoTime());
                try {
                    results.add(future.get(remaining, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("{} 超过 {} 秒未返回，跳过", activeProviders.get(i).getName(), config.getProviderTimeoutSeconds());
                    results.add(Collections.emptyList());
                } catch (ExecutionException e) {
                    log.warn("{} 处理失败: {}", activeProviders.get(i).getName(), e.getCause().toString());
                    results.add(Collections.emptyList());
                }
            }
        } catch (InterruptedException e) {
            for (Future<List<CoverArtCandidate>> future : futures) {
                future.cancel(true);
            }
            throw e;
        }
        return results;
    }

    /**
     * 依次请求各来源，来源之间等待一段礼貌间隔
     */
    private List<List<CoverArtCandidate>> fetchSequential(List<CoverArtProvider> activeProviders,
                                                          String artist, String title, int perProvider)
        throws InterruptedException {
        List<List<CoverArtCandidate>> results = new ArrayList<>();
        for (int i = 0; i < activeProviders.size(); i++) {
            if (i > 0 && config.getCourtesyDelayMs() > 0) {
                Thread.sleep(config.getCourtesyDelayMs());
            }
            results.add(fetchFromProvider(activeProviders.get(i), artist, title, perProvider));
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("封面获取被中断");
            }
        }
        return results;
    }

    /**
     * 请求单个来源并把原始图片转为候选，无效图片直接丢弃
     */
    private List<CoverArtCandidate> fetchFromProvider(CoverArtProvider provider, String artist, String title, int limit) {
        List<RawImage> rawImages = provider.fetchCandidateImages(artist, title, limit);
        List<CoverArtCandidate> candidates = new ArrayList<>();
        for (RawImage rawImage : rawImages) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            toCandidate(provider, rawImage).ifPresent(candidates::add);
        }
        return candidates;
    }

    private Optional<CoverArtCandidate> toCandidate(CoverArtProvider provider, RawImage rawImage) {
        Optional<ImageCompressor.CompressedImage> validated =
            imageCompressor.validateAndCompress(rawImage.getBytes(), config.getMaxImageBytes());
        if (validated.isEmpty()) {
            log.debug("丢弃无效图片: {} ({})", rawImage.getUrl(), provider.getName());
            return Optional.empty();
        }

        ImageCompressor.CompressedImage image = validated.get();
        if (image.isFloorReached()) {
            log.warn("图片未能压缩到 {} 字节以内，使用最小版本: {}", config.getMaxImageBytes(), rawImage.getUrl());
        }

        Fingerprint fingerprint = hasher.fingerprint(image.getBytes());
        return Optional.of(new CoverArtCandidate(rawImage.getUrl(), provider.getName(), image.getBytes(),
            image.getWidth(), image.getHeight(), fingerprint));
    }

    /**
     * 关闭线程池和所有来源的 HTTP 连接
     */
    @Override
    public void close() {
        providerExecutorService.shutdownNow();
        try {
            if (!providerExecutorService.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("封面获取线程池未能在 5 秒内结束");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (CoverArtProvider provider : providers) {
            try {
                provider.close();
            } catch (IOException e) {
                log.warn("关闭 {} 失败", provider.getName(), e);
            }
        }
    }

    private static class ProviderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "cover-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
