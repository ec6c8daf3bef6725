package com.ramsbaby.notifier.dto;

import java.time.Instant;
import java.util.Map;

/**
 * 마지막으로 성공한 조회 결과. 불변이며 교체는 항상 통째로 이루어진다.
 */
public record CacheSnapshot(
        Instant fetchedAt,
        Map<String, Appointment> appointments,
        Map<String, MailItem> mails,
        boolean ready
) {

    public static CacheSnapshot empty() {
        return new CacheSnapshot(null, Map.of(), Map.of(), false);
    }
}
