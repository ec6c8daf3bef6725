package com.ramsbaby.notifier.component;

/**
 * 알림 채널 두 개. 일정 알림/아젠다는 appointments, 메일 알림은 mail 봇으로 보낸다.
 */
public record ChatChannels(MessageGateway appointments, MessageGateway mail) {
}
