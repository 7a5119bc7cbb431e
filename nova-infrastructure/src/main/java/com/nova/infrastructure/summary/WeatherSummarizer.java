package com.nova.infrastructure.summary;

import com.nova.infrastructure.util.PayloadSummarizer;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 天气摘要：当前温度与降水，加最多三天的逐日预报（Open-Meteo 响应结构）。
 */
public class WeatherSummarizer extends AbstractDomainSummarizer {

    private static final int MAX_FORECAST_DAYS = 3;
    private static final String DEFAULT_UNIT = "°F";

    public WeatherSummarizer(Clock clock, PayloadSummarizer fallback, int maxLength) {
        super(clock, fallback, maxLength);
    }

    @Override
    protected String render(Object payload, LocalDate today) {
        Map<?, ?> data = asMap(payload);
        if (data == null) {
            return null;
        }
        if (data.isEmpty()) {
            return "Weather data unavailable.";
        }
        Map<?, ?> current = asMap(data.get("current"));
        Map<?, ?> daily = asMap(data.get("daily"));
        if (current == null && daily == null) {
            return null;
        }

        List<String> lines = new ArrayList<>();
        String unit = StringUtils.defaultIfBlank(asText(asMap(data.get("current_units")), "temperature_2m"), DEFAULT_UNIT);
        if (current != null && !current.isEmpty()) {
            lines.add("CURRENT WEATHER:");
            Number temp = asNumber(current.get("temperature_2m"));
            if (temp != null) {
                lines.add("  Temperature: " + wholeNumber(temp) + unit);
            }
            Number precip = asNumber(current.get("precipitation"));
            if (precip != null && precip.doubleValue() > 0) {
                lines.add("  Precipitation: " + plainNumber(precip) + "mm");
            } else {
                lines.add("  Precipitation: None");
            }
            lines.add("");
        }

        if (daily != null) {
            String dailyUnit = StringUtils.defaultIfBlank(
                    asText(asMap(data.get("daily_units")), "temperature_2m_max"), unit);
            appendForecast(lines, daily, dailyUnit, today);
        }
        if (lines.isEmpty()) {
            return "Weather data unavailable.";
        }
        return String.join("\n", lines);
    }

    private void appendForecast(List<String> lines, Map<?, ?> daily, String unit, LocalDate today) {
        List<?> dates = listOf(daily, "time");
        List<?> highs = listOf(daily, "temperature_2m_max");
        List<?> lows = listOf(daily, "temperature_2m_min");
        List<?> sunrises = listOf(daily, "sunrise");
        List<?> sunsets = listOf(daily, "sunset");

        for (int i = 0; i < Math.min(dates.size(), MAX_FORECAST_DAYS); i++) {
            LocalDate date = parseDate(String.valueOf(dates.get(i)));
            if (date == null) {
                continue;
            }
            String relative = relativeLabel(date, today);
            lines.add(relative != null
                    ? relative + "'S FORECAST (" + formatDateFull(date) + "):"
                    : "FORECAST FOR " + formatDateFull(date) + ":");

            Number high = i < highs.size() ? asNumber(highs.get(i)) : null;
            Number low = i < lows.size() ? asNumber(lows.get(i)) : null;
            if (high != null && low != null) {
                lines.add("  High: " + wholeNumber(high) + unit + ", Low: " + wholeNumber(low) + unit);
            }
            if (i < sunrises.size() && i < sunsets.size()) {
                lines.add("  Sunrise: " + formatTime(String.valueOf(sunrises.get(i)))
                        + ", Sunset: " + formatTime(String.valueOf(sunsets.get(i))));
            }
            lines.add("");
        }
    }

    private static List<?> listOf(Map<?, ?> map, String key) {
        List<?> list = asList(map.get(key));
        return list == null ? Collections.emptyList() : list;
    }
}
