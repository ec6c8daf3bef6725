package com.ramsbaby.notifier.dto;

public enum ItemKind {
    APPOINTMENT,
    MAIL
}
