package com.ramsbaby.notifier.component;

import com.ramsbaby.notifier.dto.FetchResult;

public interface ProviderClient {

    /**
     * 오늘 일정과 읽지 않은 메일을 조회한다.
     *
     * @throws ProviderAuthException        자격증명 오류
     * @throws ProviderUnavailableException 일시적 오류
     */
    FetchResult fetch();
}
