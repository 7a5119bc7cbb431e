package com.nova.test;

import com.google.common.cache.CacheBuilder;
import com.nova.domain.cache.service.FreshnessCacheDomainService;
import com.nova.domain.context.model.valobj.DomainSource;
import com.nova.domain.context.model.valobj.PersonaProfile;
import com.nova.domain.context.service.ContextAssembleDomainService;
import com.nova.domain.conversation.adapter.gateway.ICompletionGateway;
import com.nova.domain.conversation.model.entity.ConversationMessageEntity;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.domain.intent.service.IntentPromptDomainService;
import com.nova.domain.intent.service.IntentResolveDomainService;
import com.nova.domain.intent.service.KeywordIntentClassifier;
import com.nova.test.support.InMemoryCacheEntryRepository;
import com.nova.test.support.InMemoryConversationMessageRepository;
import com.nova.test.support.MutableClock;
import com.nova.trigger.service.AssistantChatService;
import com.nova.trigger.service.ChatReply;
import com.nova.types.enums.IntentTypeEnum;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AssistantChatServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 18, 8, 0);

    private MutableClock clock;
    private InMemoryConversationMessageRepository messageRepository;
    private ConversationLedgerDomainService ledger;
    private ICompletionGateway gateway;
    private AssistantChatService chatService;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(NOW);
        messageRepository = new InMemoryConversationMessageRepository();
        ledger = new ConversationLedgerDomainService(messageRepository, clock);
        gateway = mock(ICompletionGateway.class);

        IntentResolveDomainService resolver = new IntentResolveDomainService(new KeywordIntentClassifier(),
                new IntentPromptDomainService(), null, CacheBuilder.newBuilder().build(), 0.7, 0.8);
        FreshnessCacheDomainService cache = new FreshnessCacheDomainService(new InMemoryCacheEntryRepository(), clock);
        DomainSource weather = DomainSource.builder()
                .name("weather")
                .intent(IntentTypeEnum.WEATHER)
                .title("Weather")
                .ttl(Duration.ofMinutes(30))
                .fetcher(() -> Map.of("summary", "light rain"))
                .summarizer(String::valueOf)
                .build();
        ContextAssembleDomainService assembler = new ContextAssembleDomainService(resolver, cache, ledger,
                () -> List.of(weather), PersonaProfile.defaults(), clock, 0.3, Duration.ofHours(4), 30);
        chatService = new AssistantChatService(resolver, assembler, ledger, gateway);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldSendSystemPromptAsFirstTurnAndRecordExchange() {
        ledger.append(MessageRoleEnum.USER, "Good morning");
        ledger.append(MessageRoleEnum.ASSISTANT, "Morning! How can I help?");
        when(gateway.complete(anyString(), anyList())).thenReturn("Yes, bring an umbrella.");

        ChatReply reply = chatService.chat("  Do I need an umbrella?  ", false);

        ArgumentCaptor<List<ChatTurn>> historyCaptor = ArgumentCaptor.forClass(List.class);
        verify(gateway).complete(eq("Do I need an umbrella?"), historyCaptor.capture());
        List<ChatTurn> history = historyCaptor.getValue();
        Assertions.assertEquals(4, history.size());
        Assertions.assertEquals(MessageRoleEnum.USER, history.get(0).role());
        Assertions.assertTrue(history.get(0).content().startsWith("[System: You are Nova"));
        Assertions.assertTrue(history.get(0).content().contains("WEATHER: {summary=light rain}"));
        Assertions.assertEquals(ChatTurn.assistant("Understood. I'm Nova, ready to help!"), history.get(1));
        Assertions.assertEquals(ChatTurn.user("Good morning"), history.get(2));

        Assertions.assertEquals("Yes, bring an umbrella.", reply.reply());
        Assertions.assertEquals(IntentTypeEnum.WEATHER, reply.classification().topIntent());
        Assertions.assertEquals(1, reply.sections().size());

        List<ConversationMessageEntity> stored = messageRepository.getAll();
        Assertions.assertEquals(4, stored.size());
        Assertions.assertEquals("Do I need an umbrella?", stored.get(2).getContent());
        Assertions.assertTrue(stored.get(2).isUserMessage());
        Assertions.assertTrue(stored.get(3).isAssistantMessage());
    }

    @Test
    public void shouldNotRecordExchangeWhenCompletionFails() {
        when(gateway.complete(anyString(), any()))
                .thenThrow(new AppException(ResponseCode.COMPLETION_ERROR, "timeout"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> chatService.chat("Hello", false));

        Assertions.assertTrue(ex.is(ResponseCode.COMPLETION_ERROR));
        Assertions.assertEquals(0L, ledger.count());
    }

    @Test
    public void shouldRejectBlankMessage() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> chatService.chat(" ", false));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }
}
