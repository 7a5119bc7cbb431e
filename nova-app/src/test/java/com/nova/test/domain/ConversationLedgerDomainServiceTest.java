package com.nova.test.domain;

import com.nova.domain.conversation.model.entity.ConversationMessageEntity;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.test.support.InMemoryConversationMessageRepository;
import com.nova.test.support.MutableClock;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

public class ConversationLedgerDomainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 18, 12, 0);

    private MutableClock clock;
    private InMemoryConversationMessageRepository repository;
    private ConversationLedgerDomainService ledger;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(NOW);
        repository = new InMemoryConversationMessageRepository();
        ledger = new ConversationLedgerDomainService(repository, clock);
    }

    @Test
    public void shouldExcludeMessagesOutsideWindow() {
        clock.set(NOW.minusHours(5));
        ledger.append(MessageRoleEnum.USER, "old question");
        clock.set(NOW.minusHours(1));
        ledger.append(MessageRoleEnum.USER, "recent question");
        ledger.append(MessageRoleEnum.ASSISTANT, "recent answer");
        clock.set(NOW);

        List<ConversationMessageEntity> recent = ledger.recent(Duration.ofHours(4));

        Assertions.assertEquals(List.of("recent question", "recent answer"),
                recent.stream().map(ConversationMessageEntity::getContent).collect(Collectors.toList()));
        Assertions.assertEquals(3L, ledger.count());
    }

    @Test
    public void shouldKeepInsertionOrderForEqualTimestamps() {
        ledger.append(MessageRoleEnum.USER, "first");
        ledger.append(MessageRoleEnum.ASSISTANT, "second");
        ledger.append(MessageRoleEnum.USER, "third");

        List<ConversationMessageEntity> recent = ledger.recent(Duration.ofHours(4));

        Assertions.assertEquals(List.of("first", "second", "third"),
                recent.stream().map(ConversationMessageEntity::getContent).collect(Collectors.toList()));
        Assertions.assertTrue(recent.get(1).isAssistantMessage());
    }

    @Test
    public void shouldStampCurrentTimeAndTrimContent() {
        ConversationMessageEntity saved = ledger.append("User", "  hello Nova  ");

        Assertions.assertEquals(NOW, saved.getCreatedAt());
        Assertions.assertEquals("hello Nova", saved.getContent());
        Assertions.assertEquals(MessageRoleEnum.USER, saved.getRole());
        Assertions.assertNotNull(saved.getId());
    }

    @Test
    public void shouldRejectUnsupportedRole() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> ledger.append("system", "hi"));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertEquals("Invalid role: system. Must be 'user' or 'assistant'.", ex.getInfo());
        Assertions.assertEquals(0L, ledger.count());
    }

    @Test
    public void shouldRejectBlankContent() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> ledger.append(MessageRoleEnum.ASSISTANT, "   "));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldCapContextHistoryToNewestMessages() {
        for (int i = 1; i <= 5; i++) {
            ledger.append(i % 2 == 0 ? MessageRoleEnum.ASSISTANT : MessageRoleEnum.USER, "m" + i);
            clock.advance(Duration.ofMinutes(1));
        }

        List<ChatTurn> turns = ledger.forContext(Duration.ofHours(4), 3);

        Assertions.assertEquals(List.of("m3", "m4", "m5"),
                turns.stream().map(ChatTurn::content).collect(Collectors.toList()));
        Assertions.assertEquals(MessageRoleEnum.ASSISTANT, turns.get(1).role());
    }

    @Test
    public void shouldReturnEmptyHistoryForEmptyLedgerAndRejectNegativeWindow() {
        Assertions.assertTrue(ledger.recent(Duration.ofHours(4)).isEmpty());
        Assertions.assertTrue(ledger.forContext(Duration.ofHours(4), 30).isEmpty());
        AppException ex = Assertions.assertThrows(AppException.class, () -> ledger.recent(Duration.ofHours(-1)));
        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }
}
