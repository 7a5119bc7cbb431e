package com.nova.trigger.application;

import com.nova.domain.cache.adapter.gateway.IDataFetcher;
import com.nova.domain.cache.model.valobj.CacheEntryStatus;
import com.nova.domain.cache.model.valobj.CachedPayload;
import com.nova.domain.cache.service.FreshnessCacheDomainService;
import com.nova.domain.context.model.valobj.AssembledContext;
import com.nova.domain.context.service.ContextAssembleDomainService;
import com.nova.domain.conversation.model.entity.ConversationMessageEntity;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.domain.intent.model.valobj.ClassificationResult;
import com.nova.domain.intent.service.IntentResolveDomainService;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 核心能力门面，供路由层调用。
 */
@Service
public class AssistantCoreService {

    private final IntentResolveDomainService intentResolveDomainService;
    private final FreshnessCacheDomainService freshnessCacheDomainService;
    private final ConversationLedgerDomainService conversationLedgerDomainService;
    private final ContextAssembleDomainService contextAssembleDomainService;

    public AssistantCoreService(IntentResolveDomainService intentResolveDomainService,
                                FreshnessCacheDomainService freshnessCacheDomainService,
                                ConversationLedgerDomainService conversationLedgerDomainService,
                                ContextAssembleDomainService contextAssembleDomainService) {
        this.intentResolveDomainService = intentResolveDomainService;
        this.freshnessCacheDomainService = freshnessCacheDomainService;
        this.conversationLedgerDomainService = conversationLedgerDomainService;
        this.contextAssembleDomainService = contextAssembleDomainService;
    }

    public ClassificationResult classify(String utterance) {
        return intentResolveDomainService.resolve(utterance);
    }

    public CachedPayload cached(String key, Duration ttl, IDataFetcher fetcher, boolean forceRefresh) {
        return freshnessCacheDomainService.get(key, ttl, fetcher, forceRefresh);
    }

    public List<CacheEntryStatus> cacheStatus() {
        return freshnessCacheDomainService.status();
    }

    public ConversationMessageEntity remember(String role, String content) {
        return conversationLedgerDomainService.append(role, content);
    }

    public List<ConversationMessageEntity> history(Duration window) {
        return conversationLedgerDomainService.recent(window);
    }

    public AssembledContext assembleContext(String utterance, boolean forceRefresh) {
        return contextAssembleDomainService.assemble(utterance, forceRefresh);
    }
}
