package com.ramsbaby.notifier.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class AppPropsBindingTest {

    @Configuration
    @EnableConfigurationProperties(AppProps.class)
    static class PropsConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class)
            .withPropertyValues(
                    "app.time-zone=Asia/Seoul",
                    "app.mail.user=me@example.com",
                    "app.mail.pass=secret",
                    "app.mail.imap.host=imap.example.com",
                    "app.mail.imap.port=993",
                    "app.gcal.credentials-path=classpath:sa.json",
                    "app.gcal.calendar-id=primary",
                    "app.telegram.appointment-bot-token=appt",
                    "app.telegram.mail-bot-token=mail",
                    "app.telegram.api-base-url=https://api.telegram.org",
                    "app.telegram.allowed-chat-ids=100,200",
                    "app.telegram.admin-chat-id=1",
                    "app.telegram.command-poll-timeout=30",
                    "app.schedule.update-interval=60",
                    "app.schedule.appointment-refresh-interval=30",
                    "app.schedule.appointment-notify-interval=600",
                    "app.schedule.mail-refresh-interval=45",
                    "app.schedule.agenda-time=9:30",
                    "app.notification.keywords=urgent, outage",
                    "app.notification.mention-text=@oncall");

    @Test
    void bindsIntervalsAsSeconds() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            AppProps props = context.getBean(AppProps.class);
            assertThat(props.schedule().updateInterval()).isEqualTo(Duration.ofSeconds(60));
            assertThat(props.schedule().appointmentNotifyInterval()).isEqualTo(Duration.ofMinutes(10));
            assertThat(props.schedule().mailRefreshInterval()).isEqualTo(Duration.ofSeconds(45));
            assertThat(props.schedule().agenda()).contains(LocalTime.of(9, 30));
            assertThat(props.telegram().allowedChatIds()).containsExactly(100L, 200L);
            assertThat(props.zone()).isEqualTo(ZoneId.of("Asia/Seoul"));
            assertThat(props.mail().folderOrInbox()).isEqualTo("INBOX");
            assertThat(props.notificationOrDefault().keywordsOrEmpty()).containsExactly("urgent", "outage");
        });
    }

    @Test
    void emptyAgendaTimeDisablesAgenda() {
        runner.withPropertyValues("app.schedule.agenda-time=").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(AppProps.class).schedule().agenda()).isEmpty();
        });
    }

    @Test
    void rejectsMalformedAgendaTime() {
        runner.withPropertyValues("app.schedule.agenda-time=25:99")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsMissingChatIds() {
        runner.withPropertyValues("app.telegram.allowed-chat-ids=")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsUnknownTimeZone() {
        runner.withPropertyValues("app.time-zone=Mars/Olympus")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsZeroRefreshInterval() {
        runner.withPropertyValues("app.schedule.update-interval=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsMissingBotToken() {
        runner.withPropertyValues("app.telegram.mail-bot-token=")
                .run(context -> assertThat(context).hasFailed());
    }
}
