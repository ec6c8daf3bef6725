package com.ramsbaby.notifier.component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.ItemKind;
import com.ramsbaby.notifier.dto.MailItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class MailNotifier {

    private final CacheStore cache;
    private final ChatChannels channels;
    private final ChatDelivery delivery;
    private final MessageFormatter formatter;
    private final AppProps props;
    private final ReentrantLock tickLock = new ReentrantLock();

    public void tick() {
        if (!cache.isReady())
            return;
        if (!tickLock.tryLock())
            return;
        try {
            List<MailItem> fresh = cache.unnotifiedMail();
            log.info("메일 알림 시작: {}건, 다음 확인 {}초 후", fresh.size(),
                    props.schedule().mailRefreshInterval().toSeconds());
            for (MailItem mail : fresh) {
                String text = formatter.mailAlert(mail);
                if (delivery.toAll(channels.mail(), props.telegram().allowedChatIds(), text, null))
                    cache.markNotified(ItemKind.MAIL, mail.id());
                else
                    log.warn("메일 알림 전송 실패, 다음 주기에 재시도: {}", mail.id());
            }
        } finally {
            tickLock.unlock();
        }
    }
}
