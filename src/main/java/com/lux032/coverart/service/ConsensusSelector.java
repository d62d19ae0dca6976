package com.lux032.coverart.service;

import com.lux032.coverart.model.CoverArtCandidate;
import com.lux032.coverart.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 多源共识选择
 * 按相似度把候选分组，最大的一组视为"多数来源认可的封面"，取组内分辨率最高的一张。
 *
 * <p>分组是对种子的单链贪心：按到达顺序，每个未分组的候选作为种子开新组，
 * 之后所有未分组且与种子相似度达到阈值的候选并入该组。组员之间不再互相比较。
 */
@Slf4j
public class ConsensusSelector {

    public static final double DEFAULT_THRESHOLD = 0.85;

    private final SimilarityMetric similarityMetric;
    private final double threshold;

    public ConsensusSelector(SimilarityMetric similarityMetric) {
        this(similarityMetric, DEFAULT_THRESHOLD);
    }

    public ConsensusSelector(SimilarityMetric similarityMetric, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("相似度阈值必须在 0 到 1 之间: " + threshold);
        }
        this.similarityMetric = similarityMetric;
        this.threshold = threshold;
    }

    /**
     * 选出最佳候选并写入 similarityScore / selected
     * @param candidates 按到达顺序排列的候选
     * @return 最佳候选，列表为空时返回 empty
     */
    public Optional<CoverArtCandidate> selectBest(List<CoverArtCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        if (candidates.size() == 1) {
            CoverArtCandidate only = candidates.get(0);
            only.markSelected(1.0);
            return Optional.of(only);
        }

        log.info(I18nUtil.getMessage("consensus.clustering", candidates.size()));

        List<List<CoverArtCandidate>> groups = cluster(candidates);
        List<CoverArtCandidate> largestGroup = largestGroup(groups);
        log.info(I18nUtil.getMessage("consensus.largest.group", largestGroup.size(), groups.size()));

        CoverArtCandidate best = highestResolution(largestGroup);

        double total = 0.0;
        for (CoverArtCandidate member : largestGroup) {
            total += similarityMetric.similarity(best.getFingerprint(), member.getFingerprint());
        }
        double score = total / largestGroup.size();

        best.markSelected(score);
        log.debug("选中: {} ({}x{}) 组内相似度: {}",
            best.getProviderName(), best.getWidth(), best.getHeight(), String.format("%.1f%%", score * 100));
        return Optional.of(best);
    }

    /**
     * 单链贪心分组，组按种子的到达顺序排列，组内成员也保持到达顺序
     */
    List<List<CoverArtCandidate>> cluster(List<CoverArtCandidate> candidates) {
        List<List<CoverArtCandidate>> groups = new ArrayList<>();
        boolean[] grouped = new boolean[candidates.size()];

        for (int i = 0; i < candidates.size(); i++) {
            if (grouped[i]) {
                continue;
            }

            CoverArtCandidate seed = candidates.get(i);
            List<CoverArtCandidate> group = new ArrayList<>();
            group.add(seed);
            grouped[i] = true;

            for (int j = i + 1; j < candidates.size(); j++) {
                if (grouped[j]) {
                    continue;
                }
                double similarity = similarityMetric.similarity(seed.getFingerprint(), candidates.get(j).getFingerprint());
                if (similarity >= threshold) {
                    group.add(candidates.get(j));
                    grouped[j] = true;
                    log.debug("图片 {} 并入图片 {} 的分组 (相似度: {})", j, i, String.format("%.1f%%", similarity * 100));
                }
            }

            groups.add(Collections.unmodifiableList(group));
        }

        return groups;
    }

    /**
     * 成员最多的组；数量相同取种子最早的组
     */
    private static List<CoverArtCandidate> largestGroup(List<List<CoverArtCandidate>> groups) {
        List<CoverArtCandidate> largest = groups.get(0);
        for (List<CoverArtCandidate> group : groups) {
            if (group.size() > largest.size()) {
                largest = group;
            }
        }
        return largest;
    }

    /**
     * 像素数最大的成员；相同取最早到达的
     */
    private static CoverArtCandidate highestResolution(List<CoverArtCandidate> group) {
        CoverArtCandidate best = group.get(0);
        for (CoverArtCandidate candidate : group) {
            if (candidate.getPixelCount() > best.getPixelCount()) {
                best = candidate;
            }
        }
        return best;
    }
}
