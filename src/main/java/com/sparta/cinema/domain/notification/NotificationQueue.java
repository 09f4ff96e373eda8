package com.sparta.cinema.domain.notification;

/**
 * 알림 작업 큐 포트
 *
 * 호출자의 트랜잭션 안에서 호출되며, 트랜잭션이 커밋될 때만 작업이 실제로 전달된다.
 * 전달은 최소 한 번이므로 소비자는 중복을 걸러야 한다.
 */
public interface NotificationQueue {

    void enqueue(NotificationJobType jobType, NotificationPayload payload);
}
