package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.FetchResult;
import com.ramsbaby.notifier.dto.MailItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 주기적으로 일정/메일을 조회해 캐시 스냅샷을 교체한다.
 * 인증 오류가 나면 HALTED 로 전환되고 이후로는 조회하지 않는다(재시작 필요).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefreshDriver {

    public enum State {
        IDLE, FETCHING, HALTED
    }

    private final ProviderClient provider;
    private final CacheStore cache;
    private final Clock clock;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public void tick() {
        if (!state.compareAndSet(State.IDLE, State.FETCHING))
            return;

        Set<String> previousMailIds = cache.mails().stream().map(MailItem::id).collect(Collectors.toSet());
        log.info("일정/메일 갱신 시작");
        try {
            FetchResult result = provider.fetch();
            cache.replaceSnapshot(result.appointments(), result.mails());
            logSummary(result, previousMailIds);
            state.set(State.IDLE);
        } catch (ProviderAuthException e) {
            state.set(State.HALTED);
            log.error("인증 실패로 갱신을 영구 중단합니다. 자격증명 확인 후 재시작하세요.", e);
        } catch (RuntimeException e) {
            // ProviderUnavailableException 포함, 이번 주기만 건너뜀
            state.set(State.IDLE);
            log.warn("갱신 실패, 다음 주기에 재시도: {}", e.toString());
        }
    }

    private void logSummary(FetchResult result, Set<String> previousMailIds) {
        Instant now = Instant.now(clock);
        var future = result.appointments().stream().filter(a -> a.startAt().isAfter(now)).toList();
        String nextMinutes = future.stream()
                .map(Appointment::startAt)
                .min(Instant::compareTo)
                .map(s -> String.valueOf(Math.max(0, Duration.between(now, s).toMinutes())))
                .orElse("없음");
        long newMail = result.mails().stream().filter(m -> !previousMailIds.contains(m.id())).count();
        log.info("갱신 완료: 예정 일정 {}건, 다음 일정까지 {}분, 새 메일 {}건", future.size(), nextMinutes, newMail);
    }

    public State state() {
        return state.get();
    }
}
