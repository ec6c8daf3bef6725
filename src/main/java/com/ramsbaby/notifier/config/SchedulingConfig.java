package com.ramsbaby.notifier.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import com.ramsbaby.notifier.component.AgendaScheduler;
import com.ramsbaby.notifier.component.AppointmentNotifier;
import com.ramsbaby.notifier.component.MailNotifier;
import com.ramsbaby.notifier.component.RefreshDriver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 네 개의 주기 작업을 각자의 간격으로 등록한다. 모두 fixed-delay 라 같은 작업이 겹쳐 돌지 않는다.
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class SchedulingConfig implements SchedulingConfigurer {

    private static final Duration AGENDA_TICK = Duration.ofMinutes(1);

    private final AppProps props;
    private final RefreshDriver refreshDriver;
    private final AppointmentNotifier appointmentNotifier;
    private final MailNotifier mailNotifier;
    private final AgendaScheduler agendaScheduler;

    @Bean
    public ThreadPoolTaskScheduler notifierTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // 느린 전송이 다른 작업의 타이머를 막지 않도록 작업 수보다 여유 있게
        scheduler.setPoolSize(5);
        scheduler.setThreadNamePrefix("notifier-");
        // 종료 시 실행 중인 작업을 인터럽트(아젠다 재시도 대기 중단)하고 최대 30초 기다린다
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        var schedule = props.schedule();
        registrar.setTaskScheduler(notifierTaskScheduler());
        registrar.addFixedDelayTask(refreshDriver::tick, schedule.updateInterval());
        registrar.addFixedDelayTask(appointmentNotifier::tick, schedule.appointmentRefreshInterval());
        registrar.addFixedDelayTask(mailNotifier::tick, schedule.mailRefreshInterval());
        if (schedule.agenda().isPresent()) {
            registrar.addFixedDelayTask(agendaScheduler::tick, AGENDA_TICK);
            log.info("일일 아젠다 활성: 평일 {}", schedule.agenda().get());
        } else {
            log.info("AGENDA_TIME 미설정, 일일 아젠다 비활성");
        }
    }
}
