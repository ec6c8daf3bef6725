package com.ramsbaby.notifier.dto;

import java.time.Duration;
import java.time.Instant;

public record Appointment(
        String id,                     // 캘린더 이벤트 ID (스냅샷 내 유일)
        String subject,
        Instant startAt,               // UTC
        Instant endAt,                 // UTC
        String organizer,
        String location,
        String joinUrl,                // 위치/행아웃 링크에서 추출, 없으면 null
        boolean notified
) {

    public Appointment withNotified(boolean value) {
        return new Appointment(id, subject, startAt, endAt, organizer, location, joinUrl, value);
    }

    // 이미 시작한 일정도 알림 전이면 대상에 포함
    public boolean isDue(Instant now, Duration lead) {
        return !notified && !startAt.minus(lead).isAfter(now);
    }
}
