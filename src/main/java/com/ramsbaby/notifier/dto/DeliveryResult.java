package com.ramsbaby.notifier.dto;

public enum DeliveryResult {
    DELIVERED,
    EXHAUSTED,
    ABORTED
}
