package com.nova.test.domain;

import com.google.common.cache.CacheBuilder;
import com.nova.domain.cache.service.FreshnessCacheDomainService;
import com.nova.domain.context.adapter.repository.IDomainSourceRegistry;
import com.nova.domain.context.model.valobj.AssembledContext;
import com.nova.domain.context.model.valobj.DomainSection;
import com.nova.domain.context.model.valobj.DomainSource;
import com.nova.domain.context.model.valobj.PersonaProfile;
import com.nova.domain.context.service.ContextAssembleDomainService;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.domain.intent.service.IntentPromptDomainService;
import com.nova.domain.intent.service.IntentResolveDomainService;
import com.nova.domain.intent.service.KeywordIntentClassifier;
import com.nova.test.support.InMemoryCacheEntryRepository;
import com.nova.test.support.InMemoryConversationMessageRepository;
import com.nova.test.support.MutableClock;
import com.nova.types.enums.IntentTypeEnum;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class ContextAssembleDomainServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 18, 9, 30);

    private MutableClock clock;
    private InMemoryCacheEntryRepository cacheRepository;
    private InMemoryConversationMessageRepository messageRepository;
    private ConversationLedgerDomainService ledger;
    private ContextAssembleDomainService assembler;

    private final AtomicInteger weatherCalls = new AtomicInteger();
    private final AtomicInteger eventsCalls = new AtomicInteger();
    private final AtomicInteger todosCalls = new AtomicInteger();
    private final AtomicBoolean weatherDown = new AtomicBoolean(false);

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(NOW);
        cacheRepository = new InMemoryCacheEntryRepository();
        messageRepository = new InMemoryConversationMessageRepository();
        ledger = new ConversationLedgerDomainService(messageRepository, clock);
        assembler = newAssembler(this::defaultSources);
    }

    @Test
    public void shouldIncludeOnlyDomainsWithDetectedIntent() {
        AssembledContext context = assembler.assemble("Will I need an umbrella for my meeting?", false);

        Assertions.assertEquals(List.of("weather", "events"), sourceNames(context.getSections()));
        Assertions.assertTrue(context.getSections().stream().allMatch(DomainSection::included));
        Assertions.assertEquals(1, weatherCalls.get());
        Assertions.assertEquals(1, eventsCalls.get());
        Assertions.assertEquals(0, todosCalls.get());
        Assertions.assertNotNull(cacheRepository.findByKey("events:2026-10-18"));
        Assertions.assertNull(cacheRepository.findByKey("todos"));
    }

    @Test
    public void shouldRenderPersonaTimeAndSections() {
        AssembledContext context = assembler.assemble("What's the weather?", false);

        String prompt = context.renderSystemPrompt();

        Assertions.assertTrue(prompt.startsWith("You are Nova"));
        Assertions.assertTrue(prompt.contains("\n\nCONTEXT:\nCURRENT TIME: Sunday, October 18, 2026 at 09:30 AM"));
        Assertions.assertTrue(prompt.contains("WEATHER: {\"temp\":18}"));
        Assertions.assertFalse(prompt.contains("EVENTS"));
    }

    @Test
    public void shouldOmitFailedDomainWithNoteAndKeepOthers() {
        weatherDown.set(true);

        AssembledContext context = assembler.assemble("Will I need an umbrella for my meeting?", false);

        Assertions.assertEquals(1, context.includedSections().size());
        Assertions.assertEquals("events", context.includedSections().get(0).source());
        DomainSection omitted = context.omittedSections().get(0);
        Assertions.assertEquals(IntentTypeEnum.WEATHER, omitted.intent());
        Assertions.assertTrue(omitted.note().startsWith("[Weather unavailable: "));
        Assertions.assertTrue(context.renderSystemPrompt().contains("[Weather unavailable: "));
    }

    @Test
    public void shouldUseStaleDataWhenRefreshFails() {
        assembler.assemble("What's the weather?", false);
        clock.advance(Duration.ofHours(1));
        weatherDown.set(true);

        AssembledContext context = assembler.assemble("What's the weather?", false);

        DomainSection section = context.getSections().get(0);
        Assertions.assertTrue(section.included());
        Assertions.assertTrue(section.stale());
        Assertions.assertTrue(section.render().startsWith("WEATHER (may be outdated, last updated Oct 18 at 09:30 AM)"));
    }

    @Test
    public void shouldForceRefreshWhenRefreshIntentDetected() {
        assembler.assemble("What's the weather?", false);
        Assertions.assertEquals(1, weatherCalls.get());

        AssembledContext context = assembler.assemble("Refresh the weather please", false);

        Assertions.assertTrue(context.isForceRefresh());
        Assertions.assertEquals(2, weatherCalls.get());
        Assertions.assertEquals(List.of("weather"), sourceNames(context.getSections()));
    }

    @Test
    public void shouldHonorCallerForceRefreshFlag() {
        assembler.assemble("Any tasks for today?", false);
        AssembledContext context = assembler.assemble("Any tasks for today?", true);

        Assertions.assertTrue(context.isForceRefresh());
        Assertions.assertEquals(2, todosCalls.get());
    }

    @Test
    public void shouldNotTouchCacheForUnknownIntent() {
        AssembledContext context = assembler.assemble("Tell me a joke", false);

        Assertions.assertTrue(context.getSections().isEmpty());
        Assertions.assertEquals(0, weatherCalls.get() + eventsCalls.get() + todosCalls.get());
        Assertions.assertTrue(context.renderSystemPrompt().endsWith("CURRENT TIME: Sunday, October 18, 2026 at 09:30 AM"));
    }

    @Test
    public void shouldIncludeTrailingConversationWindow() {
        clock.set(NOW.minusHours(6));
        ledger.append(MessageRoleEnum.USER, "long ago");
        clock.set(NOW.minusMinutes(20));
        ledger.append(MessageRoleEnum.USER, "Is it raining?");
        ledger.append(MessageRoleEnum.ASSISTANT, "Just a drizzle.");
        clock.set(NOW);

        AssembledContext context = assembler.assemble("Tell me a joke", false);

        Assertions.assertEquals(2, context.getHistory().size());
        Assertions.assertEquals("Is it raining?", context.getHistory().get(0).content());
        Assertions.assertEquals(MessageRoleEnum.ASSISTANT, context.getHistory().get(1).role());
    }

    @Test
    public void shouldOmitDomainWhenSummaryFails() {
        assembler = newAssembler(() -> List.of(DomainSource.builder()
                .name("todos")
                .intent(IntentTypeEnum.TODOS)
                .title("Todos")
                .ttl(Duration.ofMinutes(5))
                .fetcher(() -> List.of("water plants"))
                .summarizer(payload -> {
                    throw new IllegalArgumentException("unexpected shape");
                })
                .build()));

        AssembledContext context = assembler.assemble("Any tasks?", false);

        Assertions.assertEquals("[Todos unavailable: unexpected shape]", context.getSections().get(0).render());
    }

    @Test
    public void shouldPropagateStoreError() {
        cacheRepository.setUnavailable(true);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> assembler.assemble("What's the weather?", false));

        Assertions.assertTrue(ex.is(ResponseCode.STORE_ERROR));
    }

    private ContextAssembleDomainService newAssembler(IDomainSourceRegistry registry) {
        IntentResolveDomainService resolver = new IntentResolveDomainService(new KeywordIntentClassifier(),
                new IntentPromptDomainService(), null, CacheBuilder.newBuilder().build(), 0.7, 0.8);
        FreshnessCacheDomainService cache = new FreshnessCacheDomainService(cacheRepository, clock);
        return new ContextAssembleDomainService(resolver, cache, ledger, registry, PersonaProfile.defaults(), clock,
                0.3, Duration.ofHours(4), 30);
    }

    private List<DomainSource> defaultSources() {
        return List.of(
                DomainSource.builder()
                        .name("weather")
                        .intent(IntentTypeEnum.WEATHER)
                        .title("Weather")
                        .cacheKey("weather")
                        .ttl(Duration.ofMinutes(30))
                        .fetcher(() -> {
                            weatherCalls.incrementAndGet();
                            if (weatherDown.get()) {
                                throw new IOException("weather service unreachable");
                            }
                            return Map.of("temp", 18);
                        })
                        .summarizer(payload -> payload instanceof Map<?, ?> map ? "{\"temp\":" + map.get("temp") + "}" : null)
                        .build(),
                DomainSource.builder()
                        .name("events")
                        .intent(IntentTypeEnum.EVENTS)
                        .title("Events")
                        .cacheKey("events")
                        .dailyScoped(true)
                        .ttl(Duration.ofMinutes(5))
                        .fetcher(() -> {
                            eventsCalls.incrementAndGet();
                            return List.of("10:00 standup");
                        })
                        .summarizer(String::valueOf)
                        .build(),
                DomainSource.builder()
                        .name("todos")
                        .intent(IntentTypeEnum.TODOS)
                        .title("Todos")
                        .cacheKey("todos")
                        .ttl(Duration.ofMinutes(5))
                        .fetcher(() -> {
                            todosCalls.incrementAndGet();
                            return List.of("water plants");
                        })
                        .summarizer(String::valueOf)
                        .build());
    }

    private List<String> sourceNames(List<DomainSection> sections) {
        return sections.stream().map(DomainSection::source).collect(Collectors.toList());
    }
}
