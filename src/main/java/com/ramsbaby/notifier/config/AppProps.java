package com.ramsbaby.notifier.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "app")
@Validated
public record AppProps(
        @NotNull @Valid Mail mail,
        @NotNull @Valid Gcal gcal,
        @NotNull @Valid Telegram telegram,
        @NotNull @Valid Schedule schedule,
        @Valid Notification notification,
        @NotBlank String timeZone) {

    public record Mail(@NotBlank String user, @NotBlank String pass, @NotNull @Valid Imap imap, String folder) {
        public record Imap(@NotBlank String host, @Positive int port) {
        }

        public String folderOrInbox() {
            return folder == null || folder.isBlank() ? "INBOX" : folder;
        }
    }

    public record Gcal(@NotBlank String credentialsPath, @NotBlank String calendarId, String applicationName) {
    }

    public record Telegram(
            @NotBlank String appointmentBotToken,
            @NotBlank String mailBotToken,
            @NotBlank String apiBaseUrl,
            @NotEmpty List<Long> allowedChatIds,
            @NotNull Long adminChatId,
            @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration commandPollTimeout) {
    }

    public record Schedule(
            @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration updateInterval,
            @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration appointmentRefreshInterval,
            @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration appointmentNotifyInterval,
            @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration mailRefreshInterval,
            String agendaTime) {

        private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

        // 비어 있으면 아젠다 발송 비활성
        public Optional<LocalTime> agenda() {
            if (agendaTime == null || agendaTime.isBlank())
                return Optional.empty();
            return Optional.of(LocalTime.parse(agendaTime.trim(), HH_MM));
        }

        @AssertTrue(message = "app.schedule.agenda-time must be HH:MM")
        public boolean isAgendaTimeValid() {
            try {
                agenda();
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }

        @AssertTrue(message = "app.schedule intervals must be positive")
        public boolean isIntervalsPositive() {
            return isPositive(updateInterval) && isPositive(appointmentRefreshInterval)
                    && isPositive(mailRefreshInterval)
                    && appointmentNotifyInterval != null && !appointmentNotifyInterval.isNegative();
        }

        private static boolean isPositive(Duration d) {
            return d != null && !d.isZero() && !d.isNegative();
        }
    }

    public record Notification(List<String> keywords, String mentionText) {

        public List<String> keywordsOrEmpty() {
            if (keywords == null)
                return List.of();
            return keywords.stream().map(String::trim).filter(k -> !k.isEmpty()).toList();
        }

        public String mentionOrEmpty() {
            return mentionText == null ? "" : mentionText.trim();
        }
    }

    public ZoneId zone() {
        return ZoneId.of(timeZone);
    }

    public Notification notificationOrDefault() {
        return notification != null ? notification : new Notification(List.of(), "");
    }

    @AssertTrue(message = "app.time-zone must be a valid IANA zone id")
    public boolean isTimeZoneValid() {
        if (timeZone == null || timeZone.isBlank())
            return true; // @NotBlank 에서 걸러짐
        try {
            zone();
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }
}
