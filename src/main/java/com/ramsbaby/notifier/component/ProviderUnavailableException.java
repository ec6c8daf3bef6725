package com.ramsbaby.notifier.component;

/**
 * 네트워크/타임아웃 등 일시적 오류. 다음 주기에 다시 시도한다.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
