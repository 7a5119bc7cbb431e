package com.nova.domain.intent.model.valobj;

import com.nova.types.enums.ClassificationStrategyEnum;
import com.nova.types.enums.IntentTypeEnum;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次请求的意图识别结果，不持久化。
 * <p>
 * scores 按置信度降序，同分按意图声明顺序；未识别时仅含 (UNKNOWN, 0)。
 * </p>
 */
@Getter
public final class ClassificationResult {

    private static final Comparator<IntentScore> ORDER = Comparator
            .comparingDouble(IntentScore::confidence).reversed()
            .thenComparing(score -> score.intent().ordinal());

    private final List<IntentScore> scores;
    private final ClassificationStrategyEnum strategy;
    private final boolean cacheHit;
    private final boolean degraded;

    private ClassificationResult(List<IntentScore> scores,
                                 ClassificationStrategyEnum strategy,
                                 boolean cacheHit,
                                 boolean degraded) {
        this.scores = scores;
        this.strategy = strategy;
        this.cacheHit = cacheHit;
        this.degraded = degraded;
    }

    public static ClassificationResult of(Map<IntentTypeEnum, Double> confidences,
                                          ClassificationStrategyEnum strategy,
                                          boolean cacheHit) {
        List<IntentScore> scores = new ArrayList<>();
        if (confidences != null) {
            for (Map.Entry<IntentTypeEnum, Double> entry : confidences.entrySet()) {
                if (entry.getKey() == null || entry.getKey() == IntentTypeEnum.UNKNOWN) {
                    continue;
                }
                double value = entry.getValue() == null ? 0.0 : entry.getValue();
                if (value > 0.0) {
                    scores.add(new IntentScore(entry.getKey(), value));
                }
            }
        }
        if (scores.isEmpty()) {
            return new ClassificationResult(unknownScores(), strategy, cacheHit, false);
        }
        scores.sort(ORDER);
        return new ClassificationResult(Collections.unmodifiableList(scores), strategy, cacheHit, false);
    }

    public static ClassificationResult unknown(ClassificationStrategyEnum strategy) {
        return new ClassificationResult(unknownScores(), strategy, false, false);
    }

    /**
     * 模型兜底失败后的降级结果。
     */
    public static ClassificationResult degraded() {
        return new ClassificationResult(unknownScores(), ClassificationStrategyEnum.MODEL_BASED, false, true);
    }

    public double topConfidence() {
        return scores.isEmpty() ? 0.0 : scores.get(0).confidence();
    }

    public IntentTypeEnum topIntent() {
        return scores.isEmpty() ? IntentTypeEnum.UNKNOWN : scores.get(0).intent();
    }

    public double confidenceOf(IntentTypeEnum intent) {
        for (IntentScore score : scores) {
            if (score.intent() == intent) {
                return score.confidence();
            }
        }
        return 0.0;
    }

    public boolean contains(IntentTypeEnum intent) {
        return scores.stream().anyMatch(score -> score.intent() == intent);
    }

    public boolean isUnknown() {
        return topIntent() == IntentTypeEnum.UNKNOWN;
    }

    /**
     * 置信度不低于阈值的意图，保持结果顺序。
     */
    public Set<IntentTypeEnum> acceptedIntents(double threshold) {
        Set<IntentTypeEnum> accepted = new LinkedHashSet<>();
        for (IntentScore score : scores) {
            if (score.intent() != IntentTypeEnum.UNKNOWN && score.confidence() >= threshold) {
                accepted.add(score.intent());
            }
        }
        return accepted;
    }

    public boolean isRefreshRequested(double threshold) {
        return acceptedIntents(threshold).contains(IntentTypeEnum.REFRESH);
    }

    public Map<IntentTypeEnum, Double> asConfidenceMap() {
        Map<IntentTypeEnum, Double> map = new EnumMap<>(IntentTypeEnum.class);
        for (IntentScore score : scores) {
            if (score.intent() != IntentTypeEnum.UNKNOWN) {
                map.put(score.intent(), score.confidence());
            }
        }
        return map;
    }

    private static List<IntentScore> unknownScores() {
        return List.of(new IntentScore(IntentTypeEnum.UNKNOWN, 0.0));
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "scores=" + scores +
                ", strategy=" + strategy +
                ", cacheHit=" + cacheHit +
                ", degraded=" + degraded +
                '}';
    }
}
