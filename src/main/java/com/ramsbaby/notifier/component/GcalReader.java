package com.ramsbaby.notifier.component;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import com.ramsbaby.notifier.config.AppProps;
import com.ramsbaby.notifier.dto.Appointment;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class GcalReader {

    private static final Pattern P_URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final String NO_SUBJECT = "(제목 없음)";

    private final AppProps props;
    private final ResourceLoader resourceLoader;

    private HttpCredentialsAdapter requestInitializer() throws IOException {
        String cfg = props.gcal().credentialsPath(); // classpath:/ file:/ 둘 다 지원
        var resource = resourceLoader.getResource(cfg);
        try (var in = resource.getInputStream()) {
            var creds = GoogleCredentials.fromStream(in)
                    .createScoped("https://www.googleapis.com/auth/calendar.readonly");
            return new HttpCredentialsAdapter(creds);
        }
    }

    /**
     * 오늘(로컬 타임존 00:00 ~ 다음날 00:00) 일정을 시작 시각 순으로 읽는다.
     */
    public List<Appointment> loadTodayAppointments(LocalDate today) {
        HttpCredentialsAdapter reqInit;
        try {
            reqInit = requestInitializer();
        } catch (IOException ioe) {
            throw new ProviderAuthException("Google Calendar 자격증명 로딩 실패: " + ioe.getMessage()
                    + "\n- app.gcal.credentials-path 를 확인하세요.", ioe);
        }

        try {
            var http = GoogleNetHttpTransport.newTrustedTransport();
            var json = GsonFactory.getDefaultInstance();
            Calendar client = new Calendar.Builder(http, json, reqInit)
                    .setApplicationName(props.gcal().applicationName())
                    .build();

            ZoneId tz = props.zone();
            var todayStart = today.atStartOfDay(tz).toInstant();
            var tomorrowStart = today.plusDays(1).atStartOfDay(tz).toInstant();

            Events resp = client.events().list(props.gcal().calendarId())
                    .setTimeMin(new DateTime(todayStart.toEpochMilli()))
                    .setTimeMax(new DateTime(tomorrowStart.toEpochMilli()))
                    .setSingleEvents(true)
                    .setOrderBy("startTime")
                    .execute();

            List<Appointment> out = new ArrayList<>();
            if (resp.getItems() == null)
                return out;
            for (Event item : resp.getItems()) {
                if ("cancelled".equals(item.getStatus()))
                    continue;
                Instant startAt = toInstant(item.getStart(), tz);
                Instant endAt = toInstant(item.getEnd(), tz);
                if (startAt == null || endAt == null)
                    continue;
                String location = item.getLocation() == null ? "" : item.getLocation();
                String subject = item.getSummary() == null || item.getSummary().isBlank() ? NO_SUBJECT
                        : item.getSummary();
                out.add(new Appointment(item.getId(), subject, startAt, endAt, organizerOf(item), location,
                        joinUrlOf(item, location), false));
            }
            return out;

        } catch (GoogleJsonResponseException gjre) {
            var code = gjre.getStatusCode();
            var details = gjre.getDetails();
            var reason = (details != null && details.getErrors() != null && !details.getErrors().isEmpty())
                    ? details.getErrors().get(0).getReason()
                    : "unknown";
            String msg = "Google Calendar 읽기 실패: HTTP " + code + " / reason=" + reason;
            if (code == 401 || code == 403)
                throw new ProviderAuthException(msg
                        + "\n- 캘린더 공유 여부(서비스 계정 이메일)와 calendarId를 확인하세요.", gjre);
            throw new ProviderUnavailableException(msg, gjre);
        } catch (IOException | GeneralSecurityException e) {
            throw new ProviderUnavailableException("Google Calendar 읽기 실패(기타): " + e.getMessage(), e);
        }
    }

    // 종일 일정은 로컬 자정 기준
    private static Instant toInstant(EventDateTime edt, ZoneId tz) {
        if (edt == null)
            return null;
        if (edt.getDateTime() != null)
            return Instant.ofEpochMilli(edt.getDateTime().getValue());
        if (edt.getDate() != null)
            return LocalDate.parse(edt.getDate().toStringRfc3339()).atStartOfDay(tz).toInstant();
        return null;
    }

    private static String organizerOf(Event item) {
        if (item.getOrganizer() == null)
            return "";
        var o = item.getOrganizer();
        if (o.getDisplayName() != null && !o.getDisplayName().isBlank())
            return o.getDisplayName();
        return o.getEmail() == null ? "" : o.getEmail();
    }

    static String joinUrlOf(Event item, String location) {
        if (item.getHangoutLink() != null && !item.getHangoutLink().isBlank())
            return item.getHangoutLink();
        return extractUrl(location);
    }

    static String extractUrl(String text) {
        if (text == null || text.isEmpty())
            return null;
        Matcher m = P_URL.matcher(text);
        return m.find() ? m.group() : null;
    }
}
