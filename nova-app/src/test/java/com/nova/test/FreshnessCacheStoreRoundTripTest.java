package com.nova.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.domain.cache.model.valobj.CachedPayload;
import com.nova.domain.cache.service.FreshnessCacheDomainService;
import com.nova.infrastructure.repository.cache.CacheEntryRepositoryImpl;
import com.nova.infrastructure.util.JsonCodec;
import com.nova.test.support.InMemoryCacheEntryDao;
import com.nova.test.support.MutableClock;
import com.nova.types.enums.CacheReadStatusEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 缓存服务经由 JSON 落库仓储的读写一致性。
 */
public class FreshnessCacheStoreRoundTripTest {

    private static final Duration TTL = Duration.ofMinutes(30);

    private MutableClock clock;
    private InMemoryCacheEntryDao cacheEntryDao;
    private FreshnessCacheDomainService cache;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(LocalDateTime.of(2026, 10, 18, 9, 30));
        cacheEntryDao = new InMemoryCacheEntryDao();
        cache = new FreshnessCacheDomainService(
                new CacheEntryRepositoryImpl(cacheEntryDao, new JsonCodec(new ObjectMapper())), clock);
    }

    @Test
    public void shouldReturnSamePayloadOnFreshFetchAndLaterHit() {
        CachedPayload first = cache.get("weather", TTL, () -> new Forecast("rain", 12.0), false);
        clock.advance(Duration.ofMinutes(10));
        CachedPayload second = cache.get("weather", TTL, () -> new Forecast("sun", 20.0), false);

        Assertions.assertEquals(CacheReadStatusEnum.FRESH, first.status());
        Assertions.assertEquals(CacheReadStatusEnum.HIT, second.status());
        Assertions.assertEquals(Map.of("summary", "rain", "temp", 12.0), first.payload());
        Assertions.assertEquals(first.payload(), second.payload());
    }

    @Test
    public void shouldReturnStoredFormFromPut() {
        CachedPayload written = cache.put("todos", new Forecast("cloudy", 9.5), TTL);

        Assertions.assertEquals(cache.peek("todos", false).payload(), written.payload());
    }

    @Test
    public void shouldFallBackToStaleWhenFetchedDataCannotBeSerialized() {
        cache.get("weather", TTL, () -> new Forecast("rain", 12.0), false);
        clock.advance(Duration.ofMinutes(31));

        CachedPayload result = cache.get("weather", TTL, Object::new, false);

        Assertions.assertEquals(CacheReadStatusEnum.STALE, result.status());
        Assertions.assertEquals(Map.of("summary", "rain", "temp", 12.0), result.payload());
        Assertions.assertEquals("{\"summary\":\"rain\",\"temp\":12.0}", cacheEntryDao.storedData("weather"));
    }

    @Test
    public void shouldRaiseFetchErrorWhenUnserializableDataHasNoFallback() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> cache.get("events", TTL, Object::new, false));

        Assertions.assertTrue(ex.is(ResponseCode.FETCH_ERROR));
        Assertions.assertNull(cacheEntryDao.storedData("events"));
    }

    public record Forecast(String summary, double temp) {
    }
}
