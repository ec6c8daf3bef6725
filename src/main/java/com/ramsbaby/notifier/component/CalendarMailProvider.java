package com.ramsbaby.notifier.component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.Appointment;
import com.ramsbaby.notifier.dto.FetchResult;
import com.ramsbaby.notifier.dto.MailItem;

import lombok.RequiredArgsConstructor;

/**
 * 구글 캘린더(오늘 일정) + IMAP(읽지 않은 메일) 조합.
 */
@Service
@RequiredArgsConstructor
public class CalendarMailProvider implements ProviderClient {

    private final AppProps props;
    private final Clock clock;
    private final GcalReader gcal;
    private final ImapMailReader mailReader;

    @Override
    public FetchResult fetch() {
        LocalDate today = LocalDate.now(clock.withZone(props.zone()));
        List<Appointment> appointments = gcal.loadTodayAppointments(today);
        List<MailItem> mails = mailReader.loadUnread();
        return new FetchResult(appointments, mails);
    }
}
