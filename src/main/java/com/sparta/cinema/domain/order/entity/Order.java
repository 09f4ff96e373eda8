package com.sparta.cinema.domain.order.entity;

import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.exception.InvalidOrderStatusException;
import com.sparta.cinema.domain.order.exception.OrderAccessDeniedException;
import com.sparta.cinema.domain.order.exception.OrderConcurrencyConflictException;
import com.sparta.cinema.domain.order.exception.OrderFrozenException;
import com.sparta.cinema.domain.order.exception.RetryBudgetExhaustedException;
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
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 엔티티
 *
 * 상태 전이는 모두 이 클래스의 메서드를 통해서만 일어나며,
 * 호출하는 쪽은 행 잠금(findByIdWithLock)을 잡은 트랜잭션 안에서 호출해야 한다.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_status_created_at", columnList = "status, created_at"),
        @Index(name = "idx_orders_user_id", columnList = "user_id"),
        @Index(name = "idx_orders_user_id_status", columnList = "user_id, status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Order extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String orderId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private OrderStatus status = OrderStatus.DRAFT;

    /**
     * 지금까지 시작된 결제 시도 수
     */
    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private int attemptCount = 0;

    /**
     * 이중 결제 등으로 수동 검토가 필요한 주문
     */
    @Column(name = "frozen", nullable = false)
    @Builder.Default
    private boolean frozen = false;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Version
    @Column(name = "version")
    private Long version;

    public static Order draft(String userId, BigDecimal totalAmount) {
        return Order.builder()
                .userId(userId)
                .totalAmount(totalAmount)
                .status(OrderStatus.DRAFT)
                .build();
    }

    /**
     * 주문자 확인
     */
    public void validateOwner(String requestUserId) {
        if (!this.userId.equals(requestUserId)) {
            throw new OrderAccessDeniedException(orderId, requestUserId);
        }
    }

    public void ensureNotFrozen() {
        if (frozen) {
            throw new OrderFrozenException(orderId);
        }
    }

    /**
     * 새 결제 시도 시작
     *
     * @return 새 시도의 순번 (1부터)
     */
    public int beginPaymentAttempt(int maxAttempts) {
        ensureNotFrozen();

        if (status == OrderStatus.AWAITING_PAYMENT) {
            throw new OrderConcurrencyConflictException(orderId);
        }
        if (status != OrderStatus.DRAFT && status != OrderStatus.PAYMENT_FAILED) {
            throw new InvalidOrderStatusException(orderId, status, "결제 시작");
        }
        if (!hasRetryBudget(maxAttempts)) {
            throw new RetryBudgetExhaustedException(orderId, maxAttempts);
        }

        this.attemptCount++;
        this.status = OrderStatus.AWAITING_PAYMENT;
        return attemptCount;
    }

    public void markPaid(LocalDateTime now) {
        requireStatus(OrderStatus.AWAITING_PAYMENT, "결제 완료");
        this.status = OrderStatus.PAID;
        this.paidAt = now;
    }

    /**
     * 결제 실패 반영. 재시도 횟수가 남아 있지 않으면 주문을 취소한다.
     *
     * @return 반영 후 상태 (PAYMENT_FAILED 또는 CANCELLED)
     */
    public OrderStatus markPaymentFailed(int maxAttempts, LocalDateTime now) {
        requireStatus(OrderStatus.AWAITING_PAYMENT, "결제 실패");
        if (hasRetryBudget(maxAttempts)) {
            this.status = OrderStatus.PAYMENT_FAILED;
        } else {
            this.status = OrderStatus.CANCELLED;
            this.cancelledAt = now;
        }
        return status;
    }

    public void cancel(LocalDateTime now) {
        ensureNotFrozen();
        if (!status.isOpen()) {
            throw new InvalidOrderStatusException(orderId, status, "주문 취소");
        }
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = now;
    }

    public void markRefunded() {
        requireStatus(OrderStatus.PAID, "환불");
        this.status = OrderStatus.REFUNDED;
    }

    public void freeze() {
        this.frozen = true;
    }

    public boolean hasRetryBudget(int maxAttempts) {
        return attemptCount < maxAttempts;
    }

    public boolean isAwaitingPayment() {
        return status == OrderStatus.AWAITING_PAYMENT;
    }

    private void requireStatus(OrderStatus expected, String action) {
        if (status != expected) {
            throw new InvalidOrderStatusException(orderId, status, action);
        }
    }
}
