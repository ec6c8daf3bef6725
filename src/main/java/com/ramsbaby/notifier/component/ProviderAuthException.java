package com.ramsbaby.notifier.component;

/**
 * 자격증명/권한 오류. 재시도해도 회복되지 않으므로 갱신 루프를 영구 정지시킨다.
 */
public class ProviderAuthException extends RuntimeException {

    public ProviderAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
