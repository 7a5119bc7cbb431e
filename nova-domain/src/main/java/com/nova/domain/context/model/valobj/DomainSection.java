package com.nova.domain.context.model.valobj;

import com.nova.types.enums.IntentTypeEnum;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 上下文中的一个领域段落：要么携带摘要，要么是省略说明。
 */
public record DomainSection(String source,
                            IntentTypeEnum intent,
                            String title,
                            String summary,
                            boolean included,
                            boolean stale,
                            LocalDateTime fetchedAt,
                            String note) {

    private static final DateTimeFormatter STALE_FORMAT = DateTimeFormatter.ofPattern("MMM dd 'at' hh:mm a", Locale.ENGLISH);

    public static DomainSection included(DomainSource source, String summary, boolean stale, LocalDateTime fetchedAt) {
        return new DomainSection(source.getName(), source.getIntent(), source.displayTitle(),
                summary, true, stale, fetchedAt, null);
    }

    public static DomainSection omitted(DomainSource source, String reason) {
        return new DomainSection(source.getName(), source.getIntent(), source.displayTitle(),
                null, false, false, null,
                "[" + source.displayTitle() + " unavailable: " + reason + "]");
    }

    public String render() {
        if (!included) {
            return note;
        }
        String header = title.toUpperCase(Locale.ROOT);
        if (stale && fetchedAt != null) {
            header += " (may be outdated, last updated " + fetchedAt.format(STALE_FORMAT) + ")";
        }
        return header + ": " + summary;
    }
}
