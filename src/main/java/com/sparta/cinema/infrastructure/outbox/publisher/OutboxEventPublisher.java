package com.sparta.cinema.infrastructure.outbox.publisher;

import com.sparta.cinema.infrastructure.outbox.EventStatus;
import com.sparta.cinema.infrastructure.outbox.entity.OutboxEvent;
import com.sparta.cinema.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 알림 Outbox를 Kafka로 발행하는 Scheduler
 *
 * 브로커 확인(ack)을 받은 이벤트만 PUBLISHED로 바꾼다.
 * 발행 실패 시 Exponential Backoff 재시도, 최대 횟수 초과 시 FAILED.
 */
@Slf4j
@Component
public class OutboxEventPublisher {

    static final int MAX_RETRY_COUNT = 5;
    private static final int BATCH_SIZE = 100;
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;

    public OutboxEventPublisher(OutboxEventRepository outboxEventRepository,
                                KafkaTemplate<String, String> kafkaTemplate,
                                @Value("${cinema.notification.topic:cinema.notifications}") String topic) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    @Scheduled(fixedDelayString = "${cinema.outbox.publish-delay-ms:5000}")
    @SchedulerLock(name = "OutboxEventPublisher_publishPendingEvents",
            lockAtMostFor = "60s", lockAtLeastFor = "1s")
    @Transactional
    public void publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findReadyToPublish(
                EventStatus.PENDING, LocalDateTime.now(), PageRequest.of(0, BATCH_SIZE));

        if (pendingEvents.isEmpty()) {
            return;
        }

        log.info("Outbox 이벤트 발행 시작 - 대상: {}건", pendingEvents.size());

        int successCount = 0;
        int failCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                publishToKafka(event);
                event.markAsPublished();
                successCount++;
                log.debug("이벤트 발행 성공 - eventId={}, orderId={}, jobType={}",
                        event.getId(), event.getOrderId(), event.getJobType());
            } catch (ExecutionException | TimeoutException e) {
                handlePublishFailure(event, e);
                failCount++;
                log.warn("이벤트 발행 실패 - eventId={}, retryCount={}, error={}",
                        event.getId(), event.getRetryCount(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handlePublishFailure(event, e);
                log.warn("이벤트 발행 중단 - eventId={}", event.getId());
                break;
            }
        }

        log.info("Outbox 이벤트 발행 완료 - 성공: {}건, 실패: {}건", successCount, failCount);
    }

    private void publishToKafka(OutboxEvent event)
            throws ExecutionException, InterruptedException, TimeoutException {
        // 같은 주문의 알림은 같은 파티션으로 보내 순서를 유지한다
        kafkaTemplate.send(topic, event.getOrderId(), event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private void handlePublishFailure(OutboxEvent event, Exception e) {
        event.incrementRetryCount(e.getMessage());

        if (!event.canRetry(MAX_RETRY_COUNT)) {
            event.markAsFailed();
            log.error("이벤트 발행 최종 실패 - eventId={}, orderId={}, maxRetry 초과",
                    event.getId(), event.getOrderId());
        }
    }

    /**
     * 매일 자정에 7일 이상 지난 PUBLISHED 이벤트 삭제
     */
    @Scheduled(cron = "${cinema.outbox.cleanup-cron:0 0 0 * * *}")
    @SchedulerLock(name = "OutboxEventPublisher_cleanupOldPublishedEvents", lockAtMostFor = "10m")
    @Transactional
    public void cleanupOldPublishedEvents() {
        LocalDateTime cutoffDate = LocalDateTime.now().minusDays(7);
        int deleted = outboxEventRepository.deletePublishedBefore(EventStatus.PUBLISHED, cutoffDate);
        log.info("오래된 Outbox 이벤트 정리 완료 - cutoffDate={}, 삭제: {}건", cutoffDate, deleted);
    }
}
