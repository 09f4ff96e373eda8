package com.sparta.cinema.domain.payment.entity;

import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 결제 시도 엔티티
 *
 * 주문 하나에 여러 건이 생길 수 있고, 시도마다 고유한 멱등성 키("{orderId}:{sequence}")를 가진다.
 * 같은 키로 재요청하면 대행사는 새 결제를 만들지 않는다.
 */
@Entity
@Table(name = "payment_attempts",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_payment_attempts_order_seq", columnNames = {"order_id", "sequence"}),
                @UniqueConstraint(name = "uk_payment_attempts_idempotency_key", columnNames = {"idempotency_key"})
        },
        indexes = {
                @Index(name = "idx_payment_attempts_gateway_ref", columnList = "gateway_reference"),
                @Index(name = "idx_payment_attempts_status_created", columnList = "status, created_at"),
                @Index(name = "idx_payment_attempts_user_id", columnList = "user_id")
        })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PaymentAttempt extends BaseEntity {

    public static final int MAX_FAILURE_REASON_LENGTH = 500;

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String attemptId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "sequence", nullable = false)
    private int sequence;

    @Column(name = "idempotency_key", nullable = false, length = 100)
    private String idempotencyKey;

    @Column(name = "gateway_reference")
    private String gatewayReference;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "method", nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentMethod method;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PaymentAttemptStatus status = PaymentAttemptStatus.PENDING;

    @Column(name = "redirect_url", length = 1000)
    private String redirectUrl;

    @Column(name = "failure_reason", length = MAX_FAILURE_REASON_LENGTH)
    private String failureReason;

    @Column(name = "reconcile_count", nullable = false)
    @Builder.Default
    private int reconcileCount = 0;

    @Column(name = "next_reconcile_at")
    private LocalDateTime nextReconcileAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static String idempotencyKey(String orderId, int sequence) {
        return orderId + ":" + sequence;
    }

    public static PaymentAttempt start(String orderId, String userId, int sequence,
                                       BigDecimal amount, PaymentMethod method) {
        return PaymentAttempt.builder()
                .orderId(orderId)
                .userId(userId)
                .sequence(sequence)
                .idempotencyKey(idempotencyKey(orderId, sequence))
                .amount(amount)
                .method(method)
                .status(PaymentAttemptStatus.PENDING)
                .build();
    }

    /**
     * 대행사 접수 결과 기록. 콜백이 먼저 도착해 이미 기록된 참조번호는 덮어쓰지 않는다.
     */
    public void recordGatewayAcceptance(String reference, String redirectUrl) {
        if (this.gatewayReference == null) {
            this.gatewayReference = reference;
        }
        this.redirectUrl = redirectUrl;
    }

    public void markSucceeded(String reference, LocalDateTime now) {
        attachReference(reference);
        this.status = PaymentAttemptStatus.SUCCEEDED;
        this.completedAt = now;
    }

    public void markFailed(String reason, LocalDateTime now) {
        this.status = PaymentAttemptStatus.FAILED;
        this.failureReason = truncate(reason);
        this.completedAt = now;
    }

    public void markExpired(LocalDateTime now) {
        this.status = PaymentAttemptStatus.EXPIRED;
        this.failureReason = "대행사에 결제 기록 없음";
        this.completedAt = now;
    }

    public void markRequiresReview(String reference, String reason, LocalDateTime now) {
        attachReference(reference);
        this.status = PaymentAttemptStatus.REQUIRES_REVIEW;
        this.failureReason = truncate(reason);
        this.completedAt = now;
    }

    public void markRefunded(LocalDateTime now) {
        this.status = PaymentAttemptStatus.REFUNDED;
        this.completedAt = now;
    }

    /**
     * 다음 대사 시각 계산. base * 2^(n-1), 최대 cap
     */
    public void scheduleNextReconcile(LocalDateTime now, Duration base, Duration cap) {
        this.reconcileCount++;
        int shift = Math.min(reconcileCount - 1, 20);
        Duration delay = base.multipliedBy(1L << shift);
        if (delay.compareTo(cap) > 0) {
            delay = cap;
        }
        this.nextReconcileAt = now.plus(delay);
    }

    public boolean isPending() {
        return status == PaymentAttemptStatus.PENDING;
    }

    // 대행사 응답 본문이 그대로 사유로 들어올 수 있다
    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_FAILURE_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_FAILURE_REASON_LENGTH);
    }

    private void attachReference(String reference) {
        if (reference != null && this.gatewayReference == null) {
            this.gatewayReference = reference;
        }
    }
}
