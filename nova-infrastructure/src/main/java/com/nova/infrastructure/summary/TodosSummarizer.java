package com.nova.infrastructure.summary;

import com.nova.infrastructure.util.PayloadSummarizer;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 待办摘要：按截止日期分组并标注优先级（Todoist：4 最高，1 最低），无截止日期的单独列出。
 */
public class TodosSummarizer extends AbstractDomainSummarizer {

    public TodosSummarizer(Clock clock, PayloadSummarizer fallback, int maxLength) {
        super(clock, fallback, maxLength);
    }

    @Override
    protected String render(Object payload, LocalDate today) {
        List<?> todos = asList(payload);
        if (todos == null) {
            Map<?, ?> wrapper = asMap(payload);
            todos = wrapper == null ? null : asList(wrapper.get("todos"));
        }
        if (todos == null) {
            return null;
        }
        if (todos.isEmpty()) {
            return "No tasks scheduled.";
        }

        TreeMap<LocalDate, List<Map<?, ?>>> byDate = new TreeMap<>();
        List<Map<?, ?>> undated = new ArrayList<>();
        int total = 0;
        for (Object item : todos) {
            Map<?, ?> todo = asMap(item);
            if (todo == null) {
                continue;
            }
            total++;
            LocalDate due = parseDate(asText(asMap(todo.get("due")), "date"));
            if (due == null) {
                undated.add(todo);
            } else {
                byDate.computeIfAbsent(due, k -> new ArrayList<>()).add(todo);
            }
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<LocalDate, List<Map<?, ?>>> entry : byDate.entrySet()) {
            String relative = relativeLabel(entry.getKey(), today);
            lines.add(relative != null
                    ? "TASKS FOR " + relative + " (" + formatDateFull(entry.getKey()) + "):"
                    : "TASKS FOR " + formatDateFull(entry.getKey()) + ":");
            entry.getValue().forEach(todo -> lines.add(formatTodo(todo)));
            lines.add("");
        }
        if (!undated.isEmpty()) {
            lines.add("TASKS (no due date):");
            undated.forEach(todo -> lines.add(formatTodo(todo)));
            lines.add("");
        }
        lines.add("Total: " + plural(total, "task"));
        return String.join("\n", lines);
    }

    private String formatTodo(Map<?, ?> todo) {
        String content = StringUtils.defaultIfBlank(asText(todo, "content"), "Untitled task");
        Number priorityValue = asNumber(todo.get("priority"));
        int priority = priorityValue == null ? 1 : priorityValue.intValue();
        if (priority == 4) {
            return "  [!] " + content + " (high priority)";
        }
        if (priority == 3) {
            return "  [-] " + content + " (medium priority)";
        }
        return "  [ ] " + content;
    }
}
