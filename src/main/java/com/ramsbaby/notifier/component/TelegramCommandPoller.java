package com.ramsbaby.notifier.component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.ChatCommand;

import lombok.extern.slf4j.Slf4j;

/**
 * 일정 봇의 getUpdates 를 롱 폴링해서 /today, /check 에 답한다.
 */
@Component
@ConditionalOnProperty(name = "app.telegram.commands-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TelegramCommandPoller implements SmartLifecycle {

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

    private final TelegramBotClient bot;
    private final AgendaCommands commands;
    private final Duration pollTimeout;
    private final Sleeper sleeper;

    private volatile boolean running;
    private volatile long offset;
    private ExecutorService executor;

    public TelegramCommandPoller(TelegramBotClient appointmentBot, AgendaCommands commands, AppProps props,
            Sleeper sleeper) {
        this.bot = appointmentBot;
        this.commands = commands;
        this.pollTimeout = props.telegram().commandPollTimeout();
        this.sleeper = sleeper;
    }

    @Override
    public synchronized void start() {
        if (running)
            return;
        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "telegram-commands");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::loop);
        log.info("[{}] 명령 폴링 시작", bot.name());
    }

    private void loop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (DeliveryException e) {
                log.warn("[{}] 명령 폴링 실패: {}", bot.name(), e.getMessage());
                backOff();
            } catch (RuntimeException e) {
                // 여기서 빠져나가면 명령 응답이 프로세스 끝까지 멈춘다
                log.error("[{}] 명령 처리 중 예기치 않은 오류", bot.name(), e);
                backOff();
            }
        }
    }

    private void backOff() {
        try {
            sleeper.sleep(ERROR_BACKOFF);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return 처리한 업데이트 수
     */
    int pollOnce() {
        List<ChatCommand> updates = bot.fetchUpdates(offset, pollTimeout);
        for (ChatCommand u : updates) {
            offset = Math.max(offset, u.updateId() + 1);
            if (u.text() == null)
                continue;
            commands.handle(u.chatId(), u.text()).ifPresent(reply -> {
                try {
                    bot.send(u.chatId(), reply);
                } catch (DeliveryException e) {
                    log.warn("[{}] chat {} 응답 실패: {}", bot.name(), u.chatId(), e.getMessage());
                }
            });
        }
        return updates.size();
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
