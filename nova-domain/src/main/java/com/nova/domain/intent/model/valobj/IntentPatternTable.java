package com.nova.domain.intent.model.valobj;

import com.nova.types.enums.IntentTypeEnum;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 意图关键词表：意图 → 触发词正则，统一按表求值。
 * <p>
 * 新增领域只需要追加一行，不改动匹配流程。
 * </p>
 */
public final class IntentPatternTable {

    private final Map<IntentTypeEnum, Pattern> patterns;

    private IntentPatternTable(Map<IntentTypeEnum, Pattern> patterns) {
        this.patterns = Collections.unmodifiableMap(patterns);
    }

    public static IntentPatternTable defaults() {
        return builder()
                .terms(IntentTypeEnum.WEATHER, List.of("weather", "temperature", "rain", "forecast", "cold", "hot",
                        "sunny", "cloudy", "umbrella", "degrees", "jacket"))
                .terms(IntentTypeEnum.EVENTS, List.of("calendar", "meeting", "event", "schedule", "appointment",
                        "busy", "free", "available"))
                .terms(IntentTypeEnum.TODOS, List.of("todo", "task", "reminder", "to-do", "tasks", "checklist"))
                .terms(IntentTypeEnum.REFRESH, List.of("refresh", "update", "latest", "check again", "refetch",
                        "reload"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<IntentTypeEnum, Pattern> getPatterns() {
        return patterns;
    }

    public static final class Builder {

        private final Map<IntentTypeEnum, Pattern> patterns = new LinkedHashMap<>();

        /**
         * 以整词、大小写不敏感方式注册触发词。
         */
        public Builder terms(IntentTypeEnum intent, List<String> terms) {
            if (intent == null || intent == IntentTypeEnum.UNKNOWN) {
                throw new IllegalStateException("Pattern intent must be a concrete intent");
            }
            if (terms == null || terms.isEmpty()) {
                throw new IllegalStateException("Pattern terms cannot be empty: " + intent);
            }
            StringBuilder alternation = new StringBuilder();
            for (String term : terms) {
                if (term == null || term.isBlank()) {
                    continue;
                }
                if (alternation.length() > 0) {
                    alternation.append('|');
                }
                alternation.append(Pattern.quote(term.trim()));
            }
            return pattern(intent, Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE));
        }

        public Builder pattern(IntentTypeEnum intent, Pattern pattern) {
            if (intent == null || intent == IntentTypeEnum.UNKNOWN || pattern == null) {
                throw new IllegalStateException("Pattern row requires a concrete intent and a pattern");
            }
            patterns.put(intent, pattern);
            return this;
        }

        public IntentPatternTable build() {
            return new IntentPatternTable(new LinkedHashMap<>(patterns));
        }
    }
}
