package com.nova.domain.context.service;

import com.nova.domain.cache.model.valobj.CachedPayload;
import com.nova.domain.cache.service.FreshnessCacheDomainService;
import com.nova.domain.context.adapter.repository.IDomainSourceRegistry;
import com.nova.domain.context.model.valobj.AssembledContext;
import com.nova.domain.context.model.valobj.DomainSection;
import com.nova.domain.context.model.valobj.DomainSource;
import com.nova.domain.context.model.valobj.PersonaProfile;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.domain.intent.model.valobj.ClassificationResult;
import com.nova.domain.intent.service.IntentResolveDomainService;
import com.nova.types.enums.IntentTypeEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 上下文组装领域服务。
 * <p>
 * 只为达到接受阈值的意图拉取领域数据；单个领域失败时以内联说明替代，不影响其他领域。
 * 存储故障（STORE_ERROR）对本次请求是致命的，直接抛出。
 * </p>
 */
@Slf4j
@Service
public class ContextAssembleDomainService {

    private static final int MAX_REASON_LENGTH = 120;

    private final IntentResolveDomainService intentResolveDomainService;
    private final FreshnessCacheDomainService freshnessCacheDomainService;
    private final ConversationLedgerDomainService conversationLedgerDomainService;
    private final IDomainSourceRegistry domainSourceRegistry;
    private final PersonaProfile personaProfile;
    private final Clock clock;
    private final double acceptanceThreshold;
    private final Duration historyWindow;
    private final int maxHistoryMessages;

    public ContextAssembleDomainService(IntentResolveDomainService intentResolveDomainService,
                                        FreshnessCacheDomainService freshnessCacheDomainService,
                                        ConversationLedgerDomainService conversationLedgerDomainService,
                                        IDomainSourceRegistry domainSourceRegistry,
                                        PersonaProfile personaProfile,
                                        Clock clock,
                                        @Value("${nova.intent.acceptance-threshold:0.3}") double acceptanceThreshold,
                                        @Value("${nova.context.history-window:4h}") Duration historyWindow,
                                        @Value("${nova.context.max-history-messages:30}") int maxHistoryMessages) {
        this.intentResolveDomainService = intentResolveDomainService;
        this.freshnessCacheDomainService = freshnessCacheDomainService;
        this.conversationLedgerDomainService = conversationLedgerDomainService;
        this.domainSourceRegistry = domainSourceRegistry;
        this.personaProfile = personaProfile == null ? PersonaProfile.defaults() : personaProfile;
        this.clock = clock;
        this.acceptanceThreshold = acceptanceThreshold;
        this.historyWindow = historyWindow;
        this.maxHistoryMessages = maxHistoryMessages;
    }

    public AssembledContext assemble(String utterance, boolean forceRefresh) {
        return assemble(intentResolveDomainService.resolve(utterance), forceRefresh);
    }

    public AssembledContext assemble(ClassificationResult classification, boolean forceRefresh) {
        if (classification == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "classification 不能为空");
        }
        Set<IntentTypeEnum> accepted = classification.acceptedIntents(acceptanceThreshold);
        boolean effectiveRefresh = forceRefresh || accepted.contains(IntentTypeEnum.REFRESH);
        LocalDateTime now = LocalDateTime.now(clock);

        List<ChatTurn> history = conversationLedgerDomainService.forContext(historyWindow, maxHistoryMessages);

        List<DomainSection> sections = new ArrayList<>();
        for (DomainSource source : domainSourceRegistry.listSources()) {
            if (source.getIntent() == null || !accepted.contains(source.getIntent())) {
                continue;
            }
            sections.add(buildSection(source, now, effectiveRefresh));
        }

        log.info("Assembled context. intents={}, forceRefresh={}, sections={}, historySize={}",
                accepted, effectiveRefresh, sections.size(), history.size());
        return AssembledContext.builder()
                .persona(personaProfile)
                .currentTime(now)
                .history(history)
                .sections(sections)
                .forceRefresh(effectiveRefresh)
                .classification(classification)
                .build();
    }

    private DomainSection buildSection(DomainSource source, LocalDateTime now, boolean forceRefresh) {
        String key = source.resolveKey(now.toLocalDate());
        CachedPayload cached;
        try {
            cached = freshnessCacheDomainService.get(key, source.getTtl(), source.getFetcher(), forceRefresh);
        } catch (AppException ex) {
            if (ex.is(ResponseCode.STORE_ERROR)) {
                throw ex;
            }
            log.warn("Domain omitted from context. source={}, key={}, code={}, info={}",
                    source.getName(), key, ex.getCode(), ex.getInfo());
            return DomainSection.omitted(source, shortReason(ex.getInfo()));
        }

        String summary;
        try {
            summary = source.getSummarizer() == null
                    ? String.valueOf(cached.payload())
                    : source.getSummarizer().apply(cached.payload());
        } catch (RuntimeException ex) {
            log.warn("Domain summary failed. source={}, key={}, error={}", source.getName(), key, ex.getMessage());
            return DomainSection.omitted(source, shortReason(ex.getMessage()));
        }
        if (StringUtils.isBlank(summary)) {
            return DomainSection.omitted(source, "no data");
        }
        if (cached.isStale()) {
            log.warn("Using stale data in context. source={}, key={}, fetchedAt={}",
                    source.getName(), key, cached.fetchedAt());
        }
        return DomainSection.included(source, summary, cached.isStale(), cached.fetchedAt());
    }

    private String shortReason(String reason) {
        if (StringUtils.isBlank(reason)) {
            return "unknown error";
        }
        return StringUtils.abbreviate(StringUtils.normalizeSpace(reason), MAX_REASON_LENGTH);
    }
}
