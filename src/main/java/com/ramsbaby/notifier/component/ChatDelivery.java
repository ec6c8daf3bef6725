package com.ramsbaby.notifier.component;

import java.time.Duration;
import java.util.Collection;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.dto.DeliveryResult;
import com.ramsbaby.notifier.dto.LinkButton;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatDelivery {

    static final int AGENDA_MAX_ATTEMPTS = 10;
    static final Duration AGENDA_RETRY_INTERVAL = Duration.ofMinutes(1);

    private final Sleeper sleeper;

    /**
     * 허용된 모든 채팅으로 한 번씩 보낸다.
     *
     * @return 한 곳 이상 전송이 확인되면 true
     */
    public boolean toAll(MessageGateway gateway, Collection<Long> chatIds, String text, LinkButton button) {
        boolean delivered = false;
        for (Long chatId : chatIds) {
            try {
                gateway.send(chatId, text, button);
                delivered = true;
            } catch (DeliveryException e) {
                log.warn("chat {} 전송 실패: {}", chatId, e.getMessage());
            }
        }
        return delivered;
    }

    /**
     * 성공할 때까지 최대 10회, 1분 간격으로 보낸다. 게이트웨이 내부 재시도 없이 시도 1회 = 요청 1번.
     */
    public DeliveryResult untilSuccess(MessageGateway gateway, long chatId, String text) {
        for (int attempt = 1; attempt <= AGENDA_MAX_ATTEMPTS; attempt++) {
            try {
                gateway.sendOnce(chatId, text);
                return DeliveryResult.DELIVERED;
            } catch (DeliveryException e) {
                log.warn("chat {} 전송 실패, 시도 {}/{}: {}", chatId, attempt, AGENDA_MAX_ATTEMPTS, e.getMessage());
            }
            if (attempt == AGENDA_MAX_ATTEMPTS)
                break;
            try {
                sleeper.sleep(AGENDA_RETRY_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("chat {} 재시도 대기 중 중단됨", chatId);
                return DeliveryResult.ABORTED;
            }
        }
        log.warn("chat {} 전송 시도 한도 초과({}회), 오늘은 포기", chatId, AGENDA_MAX_ATTEMPTS);
        return DeliveryResult.EXHAUSTED;
    }
}
