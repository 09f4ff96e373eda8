package com.sparta.cinema.domain.inbox;

/**
 * 수신 메시지 출처
 */
public enum MessageSource {
    PAYMENT_CALLBACK,
    NOTIFICATION
}
