package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.CacheSnapshot;
import com.ramsbaby.notifier.dto.ItemKind;
import com.ramsbaby.notifier.dto.MailItem;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 일정/메일 스냅샷의 유일한 보관소.
 * <p>
 * 스냅샷은 불변 객체이고 쓰기는 모두 {@code lock} 아래에서 새 스냅샷으로 교체한다.
 * 읽기는 volatile 참조 한 번만 읽으므로 항상 완성된 스냅샷만 보게 된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheStore {

    private final Clock clock;
    private final Object lock = new Object();
    private volatile CacheSnapshot current = CacheSnapshot.empty();

    public void replaceSnapshot(List<Appointment> newAppointments, List<MailItem> newMails) {
        synchronized (lock) {
            CacheSnapshot prev = current;
            Map<String, Appointment> appointments = merge(newAppointments, prev.appointments(),
                    Appointment::id, Appointment::notified, a -> a.withNotified(true));
            Map<String, MailItem> mails = merge(newMails, prev.mails(),
                    MailItem::id, MailItem::notified, m -> m.withNotified(true));
            current = new CacheSnapshot(Instant.now(clock), appointments, mails, true);
        }
    }

    // 이전 스냅샷에 같은 ID가 알림 완료 상태로 있으면 플래그를 이어받는다
    private static <T> Map<String, T> merge(List<T> incoming, Map<String, T> previous,
            Function<T, String> idOf, Predicate<T> notifiedOf, UnaryOperator<T> markNotified) {
        Map<String, T> out = new LinkedHashMap<>();
        for (T item : incoming) {
            String id = idOf.apply(item);
            if (out.containsKey(id)) {
                log.warn("중복 ID 무시: {}", id);
                continue;
            }
            T old = previous.get(id);
            boolean carry = old != null && notifiedOf.test(old);
            out.put(id, carry && !notifiedOf.test(item) ? markNotified.apply(item) : item);
        }
        return Collections.unmodifiableMap(out);
    }

    public List<Appointment> dueAppointments(Instant now, Duration notifyLead) {
        return current.appointments().values().stream()
                .filter(a -> a.isDue(now, notifyLead))
                .sorted(Comparator.comparing(Appointment::startAt))
                .toList();
    }

    public List<MailItem> unnotifiedMail() {
        return current.mails().values().stream()
                .filter(m -> !m.notified())
                .sorted(Comparator.comparing(MailItem::receivedAt))
                .toList();
    }

    /**
     * 알림 완료로 표시한다. 이미 표시됐거나 스냅샷에서 사라진 ID면 아무것도 하지 않는다.
     *
     * @return 이번 호출로 플래그가 바뀌었으면 true
     */
    public boolean markNotified(ItemKind kind, String id) {
        synchronized (lock) {
            CacheSnapshot snap = current;
            return switch (kind) {
                case APPOINTMENT -> {
                    Appointment a = snap.appointments().get(id);
                    if (a == null || a.notified())
                        yield false;
                    current = new CacheSnapshot(snap.fetchedAt(),
                            replaced(snap.appointments(), id, a.withNotified(true)), snap.mails(), snap.ready());
                    yield true;
                }
                case MAIL -> {
                    MailItem m = snap.mails().get(id);
                    if (m == null || m.notified())
                        yield false;
                    current = new CacheSnapshot(snap.fetchedAt(),
                            snap.appointments(), replaced(snap.mails(), id, m.withNotified(true)), snap.ready());
                    yield true;
                }
            };
        }
    }

    private static <T> Map<String, T> replaced(Map<String, T> source, String id, T value) {
        Map<String, T> copy = new LinkedHashMap<>(source);
        copy.put(id, value);
        return Collections.unmodifiableMap(copy);
    }

    public boolean isReady() {
        return current.ready();
    }

    // 명령 처리용 읽기 전용 뷰
    public List<Appointment> appointments() {
        return List.copyOf(current.appointments().values());
    }

    public List<MailItem> mails() {
        return List.copyOf(current.mails().values());
    }

    public Instant fetchedAt() {
        return current.fetchedAt();
    }
}
