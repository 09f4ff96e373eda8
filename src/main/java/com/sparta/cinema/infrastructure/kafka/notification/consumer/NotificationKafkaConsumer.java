package com.sparta.cinema.infrastructure.kafka.notification.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.cinema.application.notification.service.NotificationDispatchService;
import com.sparta.cinema.infrastructure.kafka.notification.message.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationKafkaConsumer {

    private final ObjectMapper objectMapper;
    private final NotificationDispatchService notificationDispatchService;

    @KafkaListener(
            topics = "${cinema.notification.topic:cinema.notifications}",
            groupId = "${cinema.notification.group-id:cinema-notification-group}",
            concurrency = "3"
    )
    public void consume(String payload) {
        NotificationMessage message;
        try {
            message = objectMapper.readValue(payload, NotificationMessage.class);
        } catch (JsonProcessingException e) {
            // 재시도해도 해석할 수 없는 메시지는 건너뛴다
            log.error("[Kafka Consumer] 알림 메시지 역직렬화 실패 - payload: {}", payload, e);
            return;
        }

        log.info("[Kafka Consumer] 알림 메시지 수신 - messageId: {}, jobType: {}, orderId: {}",
                message.messageId(), message.jobType(), message.orderId());

        // 발송 실패는 그대로 던져 컨테이너 에러 핸들러가 재전달하게 한다
        notificationDispatchService.dispatch(message);
    }
}
