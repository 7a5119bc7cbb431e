package com.nova.infrastructure.summary;

import com.nova.infrastructure.util.JsonCodec;
import com.nova.infrastructure.util.PayloadSummarizer;
import com.nova.types.enums.IntentTypeEnum;

import java.time.Clock;
import java.util.function.Function;

/**
 * 按意图选择领域摘要器。
 */
public final class DomainSummarizers {

    private DomainSummarizers() {
    }

    public static Function<Object, String> forIntent(IntentTypeEnum intent, Clock clock, JsonCodec jsonCodec, int maxLength) {
        PayloadSummarizer fallback = new PayloadSummarizer(jsonCodec, maxLength);
        if (intent == null) {
            return fallback;
        }
        switch (intent) {
            case WEATHER:
                return new WeatherSummarizer(clock, fallback, maxLength);
            case EVENTS:
                return new EventsSummarizer(clock, fallback, maxLength);
            case TODOS:
                return new TodosSummarizer(clock, fallback, maxLength);
            default:
                return fallback;
        }
    }
}
