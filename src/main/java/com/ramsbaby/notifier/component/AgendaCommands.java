package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.config.AppProps;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * /today, /check 명령 처리. 캐시는 읽기만 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgendaCommands {

    public static final String TODAY = "/today";
    public static final String CHECK = "/check";

    private final CacheStore cache;
    private final MessageFormatter formatter;
    private final AppProps props;
    private final Clock clock;

    public String today() {
        return formatter.todayList(cache.appointments(), Instant.now(clock));
    }

    public String check() {
        return formatter.checkList(cache.appointments());
    }

    public boolean isAllowed(long chatId) {
        return props.telegram().allowedChatIds().contains(chatId);
    }

    /**
     * 허용되지 않은 채팅이거나 모르는 명령이면 빈 값.
     */
    public Optional<String> handle(long chatId, String text) {
        String command = commandOf(text);
        if (command == null)
            return Optional.empty();
        if (!isAllowed(chatId)) {
            log.debug("허용되지 않은 채팅의 명령 무시: chat={} command={}", chatId, command);
            return Optional.empty();
        }
        return switch (command) {
            case TODAY -> Optional.of(today());
            case CHECK -> Optional.of(check());
            default -> Optional.empty();
        };
    }

    // "/today@my_bot arg" -> "/today"
    static String commandOf(String text) {
        if (text == null)
            return null;
        String s = text.trim();
        if (!s.startsWith("/"))
            return null;
        String first = s.split("\\s+", 2)[0];
        int at = first.indexOf('@');
        if (at > 0)
            first = first.substring(0, at);
        return first.toLowerCase(Locale.ROOT);
    }
}
