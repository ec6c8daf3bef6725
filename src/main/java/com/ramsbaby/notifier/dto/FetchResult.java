package com.ramsbaby.notifier.dto;

import java.util.List;

public record FetchResult(List<Appointment> appointments, List<MailItem> mails) {
}
