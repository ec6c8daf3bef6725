package com.ramsbaby.notifier.component;

import com.ramsbaby.notifier.dto.LinkButton;

public interface MessageGateway {

    /**
     * 네트워크 오류는 게이트웨이 안에서 몇 번 더 시도한다.
     *
     * @throws DeliveryException 전송 실패(네트워크, 레이트 리밋, 잘못된 채팅 등)
     */
    void send(long chatId, String text, LinkButton button);

    default void send(long chatId, String text) {
        send(chatId, text, null);
    }

    /**
     * 한 번만 시도한다. 재시도는 호출하는 쪽이 책임진다.
     *
     * @throws DeliveryException 전송 실패
     */
    void sendOnce(long chatId, String text);
}
