package com.ramsbaby.notifier.dto;

public record LinkButton(String label, String url) {
}
