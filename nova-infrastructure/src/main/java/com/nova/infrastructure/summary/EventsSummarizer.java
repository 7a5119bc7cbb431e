package com.nova.infrastructure.summary;

import com.nova.infrastructure.util.PayloadSummarizer;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 日程摘要：按日期分组，组内按开始时间排序，附地点与所属日历。
 * <p>
 * 接受事件数组，或带 events 字段的对象；没有可解析日期的事件不输出。
 * </p>
 */
public class EventsSummarizer extends AbstractDomainSummarizer {

    public EventsSummarizer(Clock clock, PayloadSummarizer fallback, int maxLength) {
        super(clock, fallback, maxLength);
    }

    @Override
    protected String render(Object payload, LocalDate today) {
        List<?> events = asList(payload);
        if (events == null) {
            Map<?, ?> wrapper = asMap(payload);
            events = wrapper == null ? null : asList(wrapper.get("events"));
        }
        if (events == null) {
            return null;
        }
        if (events.isEmpty()) {
            return "No events scheduled for the requested period.";
        }

        TreeMap<LocalDate, List<Map<?, ?>>> byDate = new TreeMap<>();
        for (Object item : events) {
            Map<?, ?> event = asMap(item);
            if (event == null) {
                continue;
            }
            String dateText = StringUtils.defaultIfBlank(asText(event, "date"), asText(event, "start"));
            LocalDate date = parseDate(dateText);
            if (date != null) {
                byDate.computeIfAbsent(date, k -> new ArrayList<>()).add(event);
            }
        }
        if (byDate.isEmpty()) {
            return "No events scheduled for the requested period.";
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<LocalDate, List<Map<?, ?>>> entry : byDate.entrySet()) {
            String relative = relativeLabel(entry.getKey(), today);
            lines.add(relative != null
                    ? "EVENTS FOR " + relative + " (" + formatDateFull(entry.getKey()) + "):"
                    : "EVENTS FOR " + formatDateFull(entry.getKey()) + ":");
            lines.add("");
            List<Map<?, ?>> dayEvents = entry.getValue();
            dayEvents.sort(Comparator.comparing((Map<?, ?> event) -> Objects.toString(asText(event, "start"), "")));
            for (Map<?, ?> event : dayEvents) {
                appendEvent(lines, event);
            }
            lines.add("  (" + plural(dayEvents.size(), "event") + ")");
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private void appendEvent(List<String> lines, Map<?, ?> event) {
        String summary = StringUtils.defaultIfBlank(asText(event, "summary"), "Untitled Event");
        String start = Objects.toString(asText(event, "start"), "");
        String end = asText(event, "end");

        if (!start.contains("T")) {
            lines.add("  " + summary + " (all day)");
        } else if (end != null && end.contains("T")) {
            lines.add("  " + formatTime(start) + " - " + formatTime(end) + ": " + summary);
        } else {
            lines.add("  " + formatTime(start) + ": " + summary);
        }

        String location = asText(event, "location");
        if (StringUtils.isNotBlank(location)) {
            lines.add("    at " + location);
        }
        String calendar = asText(event, "calendar");
        if (StringUtils.isNotBlank(calendar)) {
            lines.add("    " + calendar + " calendar");
        }
    }
}
