package com.ramsbaby.notifier.component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.MailItem;

import lombok.RequiredArgsConstructor;

/**
 * 텔레그램 MarkdownV2 메시지 본문을 만든다. 상태가 없으므로 어느 스레드에서나 호출 가능.
 */
@Component
@RequiredArgsConstructor
public class MessageFormatter {

    private static final String MD_V2_SPECIALS = "_*[]()~`>#+-=|{}.!\\";
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final DateTimeFormatter SENT_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm");
    private static final String NO_SUBJECT = "(제목 없음)";
    private static final int WORKDAY_START_HOUR = 9;

    private final AppProps props;

    public static String escape(String text) {
        if (text == null)
            return "";
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (char c : text.toCharArray()) {
            if (MD_V2_SPECIALS.indexOf(c) >= 0)
                sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    // "H:MM", 음수 구간은 0:00
    public static String formatDuration(Instant start, Instant end) {
        long minutes = Math.max(0, Duration.between(start, end).toMinutes());
        return String.format("%d:%02d", minutes / 60, minutes % 60);
    }

    public static boolean containsKeyword(String text, Collection<String> keywords) {
        if (text == null || keywords == null || keywords.isEmpty())
            return false;
        String lowered = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .anyMatch(k -> lowered.contains(k.toLowerCase(Locale.ROOT)));
    }

    public String meetingAlert(Appointment meeting, Instant now) {
        ZoneId tz = props.zone();
        long minutesTo = Math.max(0, Duration.between(now, meeting.startAt()).toMinutes());
        String organizer = blankTo(meeting.organizer(), "-");

        List<String> lines = new ArrayList<>();
        lines.add("*" + escape("🔔 " + minutesTo + "분 후: " + blankTo(meeting.subject(), NO_SUBJECT)) + "*");
        lines.add("주최자: *" + escape(organizer) + "*");
        lines.add("시작: " + escape(DATE_TIME.format(meeting.startAt().atZone(tz))));
        lines.add("소요: " + escape(Math.max(0, Duration.between(meeting.startAt(), meeting.endAt()).toMinutes()) + "분"));

        String location = meeting.location() == null ? "" : meeting.location().trim();
        if (meeting.joinUrl() != null)
            lines.add("링크: " + escape(meeting.joinUrl()));
        else if (!location.isEmpty())
            lines.add("장소: " + escape(location));
        return String.join("\n", lines);
    }

    public String mailAlert(MailItem mail) {
        AppProps.Notification notification = props.notificationOrDefault();
        String subject = blankTo(mail.subject(), NO_SUBJECT);
        String sender = blankTo(mail.sender(), "-");
        String preview = mail.preview() == null ? "" : mail.preview();
        String sent = SENT_AT.format(mail.receivedAt().atZone(props.zone()));

        StringBuilder sb = new StringBuilder();
        sb.append('*').append(escape(subject)).append("*\n");
        sb.append("보낸 사람: ").append(escape(sender)).append('\n');
        sb.append("보낸 시각: ").append(escape(sent));
        String quote = quote(preview);
        if (!quote.isEmpty())
            sb.append("\n\n").append(quote);

        String message = sb.toString();
        if (containsKeyword(subject + "\n" + preview, notification.keywordsOrEmpty())) {
            message = "‼️" + message;
            String mention = notification.mentionOrEmpty();
            if (!mention.isEmpty())
                message = message + "\n" + escape(mention);
        }
        return message;
    }

    /**
     * 오늘 일정 목록. 09:00 부터 첫 일정까지, 그리고 일정 사이의 빈 시간도 함께 표시한다.
     */
    public String todayList(Collection<Appointment> meetings, Instant now) {
        ZoneId tz = props.zone();
        List<String> lines = new ArrayList<>();
        lines.add("*오늘 " + escape(DATE.format(now.atZone(tz))) + "*");

        List<Appointment> sorted = sortedByStart(meetings);
        if (sorted.isEmpty()) {
            lines.add(escape("오늘 일정이 없습니다."));
            return String.join("\n", lines);
        }

        ZonedDateTime firstLocal = sorted.get(0).startAt().atZone(tz);
        LocalDate firstDay = firstLocal.toLocalDate();
        ZonedDateTime workdayStart = firstDay.atTime(WORKDAY_START_HOUR, 0).atZone(tz);
        if (workdayStart.isBefore(firstLocal))
            lines.add(windowLine(workdayStart.toInstant(), sorted.get(0).startAt(), tz));

        for (int i = 0; i < sorted.size(); i++) {
            Appointment m = sorted.get(i);
            lines.add(escape("‣" + lineOf(m, tz)));
            if (i < sorted.size() - 1) {
                Appointment next = sorted.get(i + 1);
                if (m.endAt().isBefore(next.startAt()))
                    lines.add(windowLine(m.endAt(), next.startAt(), tz));
            }
        }
        return String.join("\n", lines);
    }

    /**
     * 겹치는 일정 묶음과 묶음별로 두 개 이상이 동시에 진행되는 총 시간(분).
     */
    public String checkList(Collection<Appointment> meetings) {
        ZoneId tz = props.zone();
        List<List<Appointment>> overlaps = overlapGroups(meetings);

        List<String> lines = new ArrayList<>();
        lines.add(escape("총 겹침: " + overlaps.size()));
        for (int i = 0; i < overlaps.size(); i++) {
            List<Appointment> group = overlaps.get(i);
            lines.add("*" + escape("겹침 " + (i + 1) + ":") + "* " + escape(overlapMinutes(group) + "분"));
            for (Appointment m : group)
                lines.add(escape(lineOf(m, tz)));
            if (i < overlaps.size() - 1)
                lines.add("");
        }
        return String.join("\n", lines);
    }

    static List<List<Appointment>> overlapGroups(Collection<Appointment> meetings) {
        List<List<Appointment>> overlaps = new ArrayList<>();
        List<Appointment> group = new ArrayList<>();
        Instant groupEnd = null;
        for (Appointment m : sortedByStart(meetings)) {
            if (!group.isEmpty() && m.startAt().isBefore(groupEnd)) {
                group.add(m);
                if (m.endAt().isAfter(groupEnd))
                    groupEnd = m.endAt();
                continue;
            }
            if (group.size() > 1)
                overlaps.add(group);
            group = new ArrayList<>(List.of(m));
            groupEnd = m.endAt();
        }
        if (group.size() > 1)
            overlaps.add(group);
        return overlaps;
    }

    // 시작(+1)/종료(-1) 이벤트를 훑으며 동시 진행 수가 2 이상인 구간을 합산
    static long overlapMinutes(List<Appointment> group) {
        record Edge(Instant at, int delta) {
        }
        List<Edge> edges = new ArrayList<>();
        for (Appointment m : group) {
            if (!m.endAt().isAfter(m.startAt()))
                continue;
            edges.add(new Edge(m.startAt(), 1));
            edges.add(new Edge(m.endAt(), -1));
        }
        edges.sort(Comparator.comparing(Edge::at).thenComparingInt(Edge::delta));

        int active = 0;
        Instant last = null;
        long seconds = 0;
        for (Edge e : edges) {
            if (last != null && active >= 2)
                seconds += Duration.between(last, e.at()).getSeconds();
            active += e.delta();
            last = e.at();
        }
        return Math.max(0, seconds / 60);
    }

    private static List<Appointment> sortedByStart(Collection<Appointment> meetings) {
        return meetings.stream().sorted(Comparator.comparing(Appointment::startAt)).toList();
    }

    private static String lineOf(Appointment m, ZoneId tz) {
        String subject = blankTo(m.subject() == null ? null : m.subject().replace("\n", " ").trim(), NO_SUBJECT);
        return subject + ", " + HOUR_MINUTE.format(m.startAt().atZone(tz)) + ", "
                + formatDuration(m.startAt(), m.endAt());
    }

    private static String windowLine(Instant from, Instant to, ZoneId tz) {
        String rest = ": 시작 " + HOUR_MINUTE.format(from.atZone(tz)) + ", 길이 " + formatDuration(from, to);
        return "> *빈 시간*" + escape(rest);
    }

    private static String quote(String text) {
        if (text == null || text.isEmpty())
            return "";
        return text.lines().map(l -> "> " + escape(l)).reduce((a, b) -> a + "\n" + b).orElse("");
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
