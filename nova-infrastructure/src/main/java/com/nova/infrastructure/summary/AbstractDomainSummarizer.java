package com.nova.infrastructure.summary;

import com.nova.infrastructure.util.PayloadSummarizer;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 领域数据摘要基类：把拉取到的 JSON 结构转写为可直接放进提示词的文本。
 * <p>
 * 日期统一写成完整英文日期，今天/明天额外标注 TODAY / TOMORROW（以注入时钟为准），
 * 时间写成 12 小时制。无法识别的数据结构交给 {@link PayloadSummarizer} 兜底。
 * </p>
 */
public abstract class AbstractDomainSummarizer implements Function<Object, String> {

    private static final DateTimeFormatter WEEKDAY_MONTH = DateTimeFormatter.ofPattern("EEEE, MMMM", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_12H = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private final Clock clock;
    private final PayloadSummarizer fallback;
    private final int maxLength;

    protected AbstractDomainSummarizer(Clock clock, PayloadSummarizer fallback, int maxLength) {
        this.clock = clock;
        this.fallback = fallback;
        this.maxLength = Math.max(maxLength, 16);
    }

    @Override
    public String apply(Object payload) {
        if (payload == null) {
            return null;
        }
        String text = render(payload, LocalDate.now(clock));
        if (text == null) {
            return fallback.apply(payload);
        }
        return StringUtils.abbreviate(text.strip(), maxLength);
    }

    /**
     * @return 转写结果；数据结构不认识时返回 null
     */
    protected abstract String render(Object payload, LocalDate today);

    protected static String relativeLabel(LocalDate date, LocalDate today) {
        if (date.equals(today)) {
            return "TODAY";
        }
        if (date.equals(today.plusDays(1))) {
            return "TOMORROW";
        }
        return null;
    }

    /**
     * Sunday, October 18th, 2026
     */
    protected static String formatDateFull(LocalDate date) {
        int day = date.getDayOfMonth();
        return date.format(WEEKDAY_MONTH) + " " + day + daySuffix(day) + ", " + date.getYear();
    }

    /**
     * ISO 日期或日期时间取日期部分；无法解析返回 null。
     */
    protected static LocalDate parseDate(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        try {
            return LocalDate.parse(StringUtils.substringBefore(text.trim(), "T"));
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * 只有日期（不含 T）视为全天；带偏移量时保留原时区的钟面时间。
     */
    protected static String formatTime(String text) {
        if (StringUtils.isBlank(text) || !text.contains("T")) {
            return "All day";
        }
        String trimmed = text.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed,
                    OffsetDateTime::from, LocalDateTime::from);
            return LocalTime.from(parsed).format(TIME_12H);
        } catch (DateTimeParseException ex) {
            return trimmed;
        }
    }

    protected static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    protected static String wholeNumber(Number value) {
        return String.format(Locale.ROOT, "%.0f", value.doubleValue());
    }

    protected static String plainNumber(Number value) {
        return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
    }

    protected static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : null;
    }

    protected static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : null;
    }

    protected static Number asNumber(Object value) {
        return value instanceof Number number ? number : null;
    }

    protected static String asText(Map<?, ?> map, String key) {
        Object value = map == null ? null : map.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static String daySuffix(int day) {
        if (day >= 11 && day <= 13) {
            return "th";
        }
        switch (day % 10) {
            case 1:
                return "st";
            case 2:
                return "nd";
            case 3:
                return "rd";
            default:
                return "th";
        }
    }
}
