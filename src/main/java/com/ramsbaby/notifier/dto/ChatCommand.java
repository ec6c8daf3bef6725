package com.ramsbaby.notifier.dto;

public record ChatCommand(long updateId, long chatId, String text) {
}
