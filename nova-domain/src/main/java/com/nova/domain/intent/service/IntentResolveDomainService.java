package com.nova.domain.intent.service;

import com.google.common.cache.Cache;
import com.nova.domain.conversation.adapter.gateway.ICompletionGateway;
import com.nova.domain.intent.model.valobj.ClassificationResult;
import com.nova.types.enums.ClassificationStrategyEnum;
import com.nova.types.enums.IntentTypeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 意图解析领域服务：规则快路径 + 查询缓存 + 模型兜底。
 * <p>
 * 每次识别相互独立、不保留状态；任何模型侧失败都降级为 UNKNOWN，不向上抛出。
 * </p>
 */
@Slf4j
@Service
public class IntentResolveDomainService {

    private final KeywordIntentClassifier keywordIntentClassifier;
    private final IntentPromptDomainService intentPromptDomainService;
    private final ICompletionGateway completionGateway;
    private final Cache<String, Map<IntentTypeEnum, Double>> intentQueryCache;
    private final double fastPathThreshold;
    private final double modelLabelConfidence;

    private final Counter fastPathCounter;
    private final Counter queryCacheHitCounter;
    private final Counter modelCounter;
    private final Counter degradedCounter;

    public IntentResolveDomainService(KeywordIntentClassifier keywordIntentClassifier,
                                      IntentPromptDomainService intentPromptDomainService,
                                      @Nullable ICompletionGateway completionGateway,
                                      @Qualifier("intentQueryCache") Cache<String, Map<IntentTypeEnum, Double>> intentQueryCache,
                                      @Value("${nova.intent.fast-path-threshold:0.7}") double fastPathThreshold,
                                      @Value("${nova.intent.model-label-confidence:0.8}") double modelLabelConfidence) {
        this.keywordIntentClassifier = keywordIntentClassifier;
        this.intentPromptDomainService = intentPromptDomainService;
        this.completionGateway = completionGateway;
        this.intentQueryCache = intentQueryCache;
        this.fastPathThreshold = fastPathThreshold;
        this.modelLabelConfidence = Math.min(Math.max(modelLabelConfidence, 0.0), 1.0);
        this.fastPathCounter = Counter.builder("nova.intent.fast_path.total").register(Metrics.globalRegistry);
        this.queryCacheHitCounter = Counter.builder("nova.intent.query_cache.hit.total").register(Metrics.globalRegistry);
        this.modelCounter = Counter.builder("nova.intent.model.total").register(Metrics.globalRegistry);
        this.degradedCounter = Counter.builder("nova.intent.degraded.total").register(Metrics.globalRegistry);
    }

    public ClassificationResult resolve(String utterance) {
        ClassificationResult ruleResult = keywordIntentClassifier.classify(utterance);
        if (StringUtils.isBlank(utterance)) {
            return ruleResult;
        }
        if (ruleResult.topConfidence() >= fastPathThreshold) {
            fastPathCounter.increment();
            log.info("Intent resolved by fast-path. utterance='{}', scores={}", abbreviate(utterance), ruleResult.getScores());
            return ruleResult;
        }
        if (completionGateway == null) {
            log.debug("Intent model fallback unavailable, keeping rule result. utterance='{}'", abbreviate(utterance));
            return ruleResult;
        }

        String cacheKey = normalize(utterance);
        Map<IntentTypeEnum, Double> cached = intentQueryCache == null ? null : intentQueryCache.getIfPresent(cacheKey);
        if (cached != null) {
            queryCacheHitCounter.increment();
            ClassificationResult result = ClassificationResult.of(merge(ruleResult, cached),
                    ClassificationStrategyEnum.MODEL_BASED, true);
            log.info("Intent resolved by query-cache. utterance='{}', scores={}", abbreviate(utterance), result.getScores());
            return result;
        }

        try {
            String output = completionGateway.complete(intentPromptDomainService.buildPrompt(utterance));
            Map<IntentTypeEnum, Double> modelScores = intentPromptDomainService.parseModelOutput(output, modelLabelConfidence);
            if (intentQueryCache != null) {
                intentQueryCache.put(cacheKey, modelScores);
            }
            modelCounter.increment();
            ClassificationResult result = ClassificationResult.of(merge(ruleResult, modelScores),
                    ClassificationStrategyEnum.MODEL_BASED, false);
            log.info("Intent resolved by model. utterance='{}', scores={}", abbreviate(utterance), result.getScores());
            return result;
        } catch (RuntimeException ex) {
            degradedCounter.increment();
            log.warn("Intent model classification failed, degrade to UNKNOWN. utterance='{}', error={}",
                    abbreviate(utterance), ex.getMessage());
            return ClassificationResult.degraded();
        }
    }

    /**
     * 查询缓存键：小写、去首尾空白、折叠连续空白。
     */
    public static String normalize(String utterance) {
        return StringUtils.normalizeSpace(StringUtils.defaultString(utterance)).toLowerCase(Locale.ROOT);
    }

    private Map<IntentTypeEnum, Double> merge(ClassificationResult ruleResult, Map<IntentTypeEnum, Double> modelScores) {
        Map<IntentTypeEnum, Double> merged = new EnumMap<>(IntentTypeEnum.class);
        merged.putAll(ruleResult.asConfidenceMap());
        if (modelScores != null) {
            modelScores.forEach((intent, confidence) -> merged.merge(intent, confidence, Math::max));
        }
        return merged;
    }

    private String abbreviate(String utterance) {
        return StringUtils.abbreviate(utterance, 50);
    }
}
