package com.nova.domain.intent.service;

import com.nova.domain.intent.model.valobj.ClassificationResult;
import com.nova.domain.intent.model.valobj.IntentPatternTable;
import com.nova.types.enums.ClassificationStrategyEnum;
import com.nova.types.enums.IntentTypeEnum;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 关键词规则引擎：纯函数，不做 I/O，不抛异常。
 * <p>
 * 单个触发词命中给 0.7，两个及以上给 0.9。
 * </p>
 */
@Component
public class KeywordIntentClassifier {

    public static final double SINGLE_MATCH_CONFIDENCE = 0.7;
    public static final double MULTI_MATCH_CONFIDENCE = 0.9;

    private final IntentPatternTable patternTable;

    public KeywordIntentClassifier() {
        this(IntentPatternTable.defaults());
    }

    @Autowired
    public KeywordIntentClassifier(IntentPatternTable patternTable) {
        this.patternTable = patternTable == null ? IntentPatternTable.defaults() : patternTable;
    }

    public ClassificationResult classify(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return ClassificationResult.unknown(ClassificationStrategyEnum.RULE_BASED);
        }
        Map<IntentTypeEnum, Double> confidences = new EnumMap<>(IntentTypeEnum.class);
        for (Map.Entry<IntentTypeEnum, Pattern> row : patternTable.getPatterns().entrySet()) {
            int hits = countHits(row.getValue(), utterance);
            if (hits > 0) {
                confidences.put(row.getKey(), hits == 1 ? SINGLE_MATCH_CONFIDENCE : MULTI_MATCH_CONFIDENCE);
            }
        }
        return ClassificationResult.of(confidences, ClassificationStrategyEnum.RULE_BASED, false);
    }

    private int countHits(Pattern pattern, String utterance) {
        Matcher matcher = pattern.matcher(utterance);
        int hits = 0;
        while (matcher.find() && hits < 2) {
            hits++;
        }
        return hits;
    }
}
