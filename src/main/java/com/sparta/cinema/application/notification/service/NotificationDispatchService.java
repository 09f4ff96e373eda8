package com.sparta.cinema.application.notification.service;

import com.sparta.cinema.domain.inbox.MessageSource;
import com.sparta.cinema.domain.inbox.entity.ProcessedMessage;
import com.sparta.cinema.domain.inbox.repository.ProcessedMessageRepository;
import com.sparta.cinema.infrastructure.external.ExternalNotificationService;
import com.sparta.cinema.infrastructure.kafka.notification.message.NotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 알림 발송 (Idempotent Consumer)
 *
 * 같은 messageId는 한 번만 발송한다.
 * 발송이 실패하면 처리 기록도 롤백되어 재전달 시 다시 시도한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

    private final ProcessedMessageRepository processedMessageRepository;
    private final ExternalNotificationService externalNotificationService;

    /**
     * @return 실제로 발송했으면 true, 중복이면 false
     */
    @Transactional
    public boolean dispatch(NotificationMessage message) {
        if (processedMessageRepository.existsById(message.messageId())) {
            log.info("[알림] 중복 메시지 무시 - messageId: {}, orderId: {}", message.messageId(), message.orderId());
            return false;
        }

        processedMessageRepository.save(new ProcessedMessage(message.messageId(), MessageSource.NOTIFICATION));
        externalNotificationService.send(message);
        return true;
    }
}
