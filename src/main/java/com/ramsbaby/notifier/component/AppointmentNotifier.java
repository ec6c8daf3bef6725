package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.ItemKind;
import com.ramsbaby.notifier.dto.LinkButton;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class AppointmentNotifier {

    private final CacheStore cache;
    private final ChatChannels channels;
    private final ChatDelivery delivery;
    private final MessageFormatter formatter;
    private final AppProps props;
    private final Clock clock;
    private final ReentrantLock tickLock = new ReentrantLock();

    public void tick() {
        if (!cache.isReady())
            return;
        // 이전 주기가 아직 전송 중이면 건너뜀 (같은 일정 중복 발송 방지)
        if (!tickLock.tryLock())
            return;
        try {
            Instant now = Instant.now(clock);
            List<Appointment> due = cache.dueAppointments(now, props.schedule().appointmentNotifyInterval());
            log.info("일정 알림 시작: {}건, 다음 확인 {}초 후", due.size(),
                    props.schedule().appointmentRefreshInterval().toSeconds());
            for (Appointment meeting : due) {
                String text = formatter.meetingAlert(meeting, now);
                LinkButton button = meeting.joinUrl() == null ? null : new LinkButton("참여하기", meeting.joinUrl());
                if (delivery.toAll(channels.appointments(), props.telegram().allowedChatIds(), text, button))
                    cache.markNotified(ItemKind.APPOINTMENT, meeting.id());
                else
                    log.warn("일정 알림 전송 실패, 다음 주기에 재시도: {}", meeting.id());
            }
        } finally {
            tickLock.unlock();
        }
    }
}
