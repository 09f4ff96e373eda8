package com.sparta.cinema.infrastructure.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.cinema.domain.notification.NotificationJobType;
import com.sparta.cinema.domain.notification.NotificationPayload;
import com.sparta.cinema.domain.notification.NotificationQueue;
import com.sparta.cinema.infrastructure.kafka.notification.message.NotificationMessage;
import com.sparta.cinema.infrastructure.outbox.entity.OutboxEvent;
import com.sparta.cinema.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * NotificationQueue 구현체: 알림 작업을 Outbox 테이블에 저장
 * 호출자 트랜잭션에 참여하므로 롤백되면 알림도 남지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxNotificationQueue implements NotificationQueue {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void enqueue(NotificationJobType jobType, NotificationPayload payload) {
        NotificationMessage message = new NotificationMessage(
                UUID.randomUUID().toString(),
                jobType,
                payload.orderId(),
                payload.userId(),
                payload.amount(),
                payload.detail(),
                LocalDateTime.now()
        );

        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("알림 메시지 직렬화 실패 - orderId: " + payload.orderId(), e);
        }

        outboxEventRepository.save(OutboxEvent.builder()
                .messageId(message.messageId())
                .orderId(payload.orderId())
                .jobType(jobType.name())
                .payload(json)
                .build());

        log.debug("알림 작업 적재 - orderId: {}, jobType: {}", payload.orderId(), jobType);
    }
}
