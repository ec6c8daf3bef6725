package com.ramsbaby.notifier.component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.MailItem;

final class Fixtures {

    static final String ZONE = "Asia/Seoul";
    static final List<Long> CHATS = List.of(100L, 200L);

    private Fixtures() {
    }

    static AppProps props() {
        return props(List.of(), "", "");
    }

    static AppProps props(List<String> keywords, String mention, String agendaTime) {
        return new AppProps(
                new AppProps.Mail("user", "pass", new AppProps.Mail.Imap("imap.example.com", 993), "INBOX"),
                new AppProps.Gcal("classpath:sa.json", "primary", "test"),
                new AppProps.Telegram("appt-token", "mail-token", "https://api.telegram.org", CHATS, 1L,
                        Duration.ofSeconds(30)),
                new AppProps.Schedule(Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofSeconds(600),
                        Duration.ofSeconds(30), agendaTime),
                new AppProps.Notification(keywords, mention),
                ZONE);
    }

    static Appointment appointment(String id, Instant start) {
        return appointment(id, "Meeting " + id, start, start.plus(Duration.ofMinutes(30)));
    }

    static Appointment appointment(String id, String subject, Instant start, Instant end) {
        return new Appointment(id, subject, start, end, "Kim", "Room 1", null, false);
    }

    static MailItem mail(String id, String subject, String preview, Instant receivedAt) {
        return new MailItem(id, subject, "Lee", receivedAt, preview, false);
    }
}
