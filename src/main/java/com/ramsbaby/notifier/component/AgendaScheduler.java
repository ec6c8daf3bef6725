package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.DeliveryResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 평일 지정 시각에 /today, /check 결과를 허용된 모든 채팅으로 보낸다. 하루 한 번.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgendaScheduler {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final CacheStore cache;
    private final AgendaCommands commands;
    private final ChatChannels channels;
    private final ChatDelivery delivery;
    private final AppProps props;
    private final Clock clock;

    private volatile LocalDate lastFiredDate;

    public synchronized void tick() {
        Optional<LocalTime> agendaTime = props.schedule().agenda();
        if (agendaTime.isEmpty())
            return;

        ZonedDateTime nowLocal = ZonedDateTime.now(clock.withZone(props.zone()));
        if (!isWeekday(nowLocal.getDayOfWeek()))
            return;
        if (nowLocal.toLocalDate().equals(lastFiredDate))
            return;
        if (nowLocal.toLocalTime().isBefore(agendaTime.get()))
            return;
        if (!cache.isReady()) {
            log.debug("캐시 준비 전이라 아젠다 발송 보류");
            return;
        }

        lastFiredDate = nowLocal.toLocalDate();
        log.info("일일 아젠다 발송: {}", DAY.format(nowLocal));
        sendDigest();
    }

    /**
     * 요일/시각 조건 없이 즉시 발송한다. 캐시가 준비되지 않았으면 false.
     */
    public boolean sendDigest() {
        if (!cache.isReady())
            return false;
        String todayText = commands.today();
        String checkText = commands.check();
        List<Long> chats = props.telegram().allowedChatIds();
        for (String text : List.of(todayText, checkText)) {
            for (Long chatId : chats) {
                DeliveryResult result = delivery.untilSuccess(channels.appointments(), chatId, text);
                if (result == DeliveryResult.ABORTED)
                    return true;
            }
        }
        return true;
    }

    public boolean isReady() {
        return cache.isReady();
    }

    private static boolean isWeekday(DayOfWeek d) {
        return d != DayOfWeek.SATURDAY && d != DayOfWeek.SUNDAY;
    }

    LocalDate lastFiredDate() {
        return lastFiredDate;
    }
}
