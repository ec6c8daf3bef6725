package com.ramsbaby.notifier.config;

import java.net.http.HttpClient;
import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ramsbaby.notifier.component.ChatChannels;
import com.ramsbaby.notifier.component.Sleeper;
import com.ramsbaby.notifier.component.TelegramBotClient;

@Configuration
public class TelegramConfig {

    @Bean
    public HttpClient telegramHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // 명령(/today, /check)은 일정 봇으로 받는다
    @Bean
    public TelegramBotClient appointmentBot(AppProps props, HttpClient telegramHttpClient, ObjectMapper om,
            Sleeper sleeper) {
        var tg = props.telegram();
        return new TelegramBotClient("appointment-bot", tg.appointmentBotToken(), tg.apiBaseUrl(),
                telegramHttpClient, om, sleeper);
    }

    @Bean
    public ChatChannels chatChannels(TelegramBotClient appointmentBot, AppProps props,
            HttpClient telegramHttpClient, ObjectMapper om, Sleeper sleeper) {
        var tg = props.telegram();
        var mailBot = new TelegramBotClient("mail-bot", tg.mailBotToken(), tg.apiBaseUrl(),
                telegramHttpClient, om, sleeper);
        return new ChatChannels(appointmentBot, mailBot);
    }
}
