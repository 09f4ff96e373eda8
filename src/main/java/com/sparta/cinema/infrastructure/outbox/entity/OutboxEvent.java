package com.sparta.cinema.infrastructure.outbox.entity;

import com.sparta.cinema.infrastructure.outbox.EventStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 알림 작업 Outbox 엔티티
 * 주문/결제 상태 변경과 같은 트랜잭션에 저장되어, 커밋된 변경에 대해서만 알림이 발행된다
 */
@Entity
@Table(name = "notification_outbox", indexes = {
        @Index(name = "idx_outbox_status_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_outbox_order", columnList = "order_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "message_id", nullable = false, unique = true)
    private String messageId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "job_type", nullable = false)
    private String jobType;        // PAYMENT_SUCCEEDED, ORDER_CANCELLED ...

    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EventStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.status == null) {
            this.status = EventStatus.PENDING;
        }
        if (this.nextRetryAt == null) {
            this.nextRetryAt = this.createdAt;
        }
    }

    public void markAsPublished() {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = LocalDateTime.now();
        this.errorMessage = null;
    }

    public void markAsFailed() {
        this.status = EventStatus.FAILED;
    }

    /**
     * 재시도 카운트 증가 및 다음 재시도 시간 설정
     * Exponential Backoff: 20초 → 40초 → 80초 → 160초
     */
    public void incrementRetryCount(String errorMessage) {
        this.retryCount++;
        this.errorMessage = errorMessage;

        long delaySec = (1L << this.retryCount) * 10;
        this.nextRetryAt = LocalDateTime.now().plusSeconds(delaySec);
    }

    public boolean canRetry(int maxRetryCount) {
        return this.retryCount < maxRetryCount && this.status == EventStatus.PENDING;
    }
}
