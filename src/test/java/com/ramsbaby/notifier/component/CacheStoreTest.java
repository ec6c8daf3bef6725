package com.ramsbaby.notifier.component;

import static com.ramsbaby.notifier.component.Fixtures.appointment;
import static com.ramsbaby.notifier.component.Fixtures.mail;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.ItemKind;
import com.ramsbaby.notifier.dto.MailItem;

class CacheStoreTest {

    private static final Instant T = Instant.parse("2026-10-19T05:00:00Z");
    private static final Duration LEAD = Duration.ofSeconds(600);

    private CacheStore store;

    @BeforeEach
    void setUp() {
        store = new CacheStore(Clock.fixed(T.minus(Duration.ofHours(1)), ZoneOffset.UTC));
    }

    @Test
    void notReadyUntilFirstSnapshot() {
        assertThat(store.isReady()).isFalse();
        assertThat(store.fetchedAt()).isNull();

        store.replaceSnapshot(List.of(), List.of());

        assertThat(store.isReady()).isTrue();
        assertThat(store.fetchedAt()).isNotNull();
    }

    @Test
    void appointmentBecomesDueAtLeadTimeAndDropsOutAfterMarked() {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());

        assertThat(store.dueAppointments(T.minusSeconds(601), LEAD)).isEmpty();
        assertThat(store.dueAppointments(T.minusSeconds(599), LEAD))
                .extracting(Appointment::id).containsExactly("A1");

        store.markNotified(ItemKind.APPOINTMENT, "A1");

        assertThat(store.dueAppointments(T.minusSeconds(1), LEAD)).isEmpty();
    }

    @Test
    void alreadyStartedAppointmentIsStillDueUntilMarked() {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());

        assertThat(store.dueAppointments(T.plus(Duration.ofMinutes(20)), LEAD))
                .extracting(Appointment::id).containsExactly("A1");
    }

    @Test
    void replaceSnapshotCarriesNotifiedFlagsForPersistingIds() {
        store.replaceSnapshot(List.of(appointment("A1", T), appointment("A2", T)),
                List.of(mail("M1", "s", "p", T)));
        store.markNotified(ItemKind.APPOINTMENT, "A1");
        store.markNotified(ItemKind.MAIL, "M1");

        store.replaceSnapshot(List.of(appointment("A1", T), appointment("A3", T)),
                List.of(mail("M1", "s", "p", T), mail("M2", "s2", "p2", T)));

        assertThat(store.appointments())
                .extracting(Appointment::id, Appointment::notified)
                .containsExactly(
                        tuple("A1", true),
                        tuple("A3", false));
        assertThat(store.unnotifiedMail()).extracting(MailItem::id).containsExactly("M2");
    }

    @Test
    void droppedIdLosesItsFlag() {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());
        store.markNotified(ItemKind.APPOINTMENT, "A1");

        store.replaceSnapshot(List.of(), List.of());
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());

        assertThat(store.dueAppointments(T, LEAD)).extracting(Appointment::id).containsExactly("A1");
    }

    @Test
    void markNotifiedIsIdempotent() {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());

        assertThat(store.markNotified(ItemKind.APPOINTMENT, "A1")).isTrue();
        assertThat(store.markNotified(ItemKind.APPOINTMENT, "A1")).isFalse();
        assertThat(store.markNotified(ItemKind.APPOINTMENT, "unknown")).isFalse();
        assertThat(store.markNotified(ItemKind.MAIL, "A1")).isFalse();
    }

    @Test
    void duplicateIdsInIncomingSnapshotKeepFirst() {
        store.replaceSnapshot(List.of(appointment("A1", "first", T, T.plusSeconds(60)),
                appointment("A1", "second", T, T.plusSeconds(60))), List.of());

        assertThat(store.appointments()).extracting(Appointment::subject).containsExactly("first");
    }

    @Test
    void concurrentMarkFlipsExactlyOnce() throws Exception {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return store.markNotified(ItemKind.APPOINTMENT, "A1");
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int flipped = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS))
                    flipped++;
            }
            assertThat(flipped).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void markingAfterReplacementAppliesToCurrentSnapshot() {
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());
        List<Appointment> due = store.dueAppointments(T, LEAD);

        // 전송 중에 새 스냅샷이 들어와도 같은 ID면 표시가 유지된다
        store.replaceSnapshot(List.of(appointment("A1", T)), List.of());
        store.markNotified(ItemKind.APPOINTMENT, due.get(0).id());

        assertThat(store.dueAppointments(T, LEAD)).isEmpty();
    }
}
