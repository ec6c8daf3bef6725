package com.ramsbaby;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import com.ramsbaby.notifier.config.AppProps;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
@Slf4j
public class Main {
    private final AppProps props;

    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }

    @PostConstruct
    public void init() {
        var s = props.schedule();
        log.info("알림 봇 시작: tz={} 허용 채팅 {}개, admin={}, 갱신 {}s / 일정 확인 {}s (사전 알림 {}s) / 메일 확인 {}s",
                props.zone(), props.telegram().allowedChatIds().size(), props.telegram().adminChatId(),
                s.updateInterval().toSeconds(), s.appointmentRefreshInterval().toSeconds(),
                s.appointmentNotifyInterval().toSeconds(), s.mailRefreshInterval().toSeconds());
    }
}
