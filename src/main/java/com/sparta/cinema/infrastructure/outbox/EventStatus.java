package com.sparta.cinema.infrastructure.outbox;

/**
 * Outbox 이벤트 발행 상태
 */
public enum EventStatus {
    PENDING,
    PUBLISHED,
    FAILED
}
