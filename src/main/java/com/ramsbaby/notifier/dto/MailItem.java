package com.ramsbaby.notifier.dto;

import java.time.Instant;

public record MailItem(
        String id,                     // Message-ID 헤더 (없으면 폴더 UID)
        String subject,
        String sender,
        Instant receivedAt,            // UTC
        String preview,                // 본문 앞 2줄, 최대 200자
        boolean notified
) {

    public MailItem withNotified(boolean value) {
        return new MailItem(id, subject, sender, receivedAt, preview, value);
    }
}
