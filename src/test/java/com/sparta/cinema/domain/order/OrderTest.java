package com.sparta.cinema.domain.order;

import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.InvalidOrderStatusException;
import com.sparta.cinema.domain.order.exception.OrderAccessDeniedException;
import com.sparta.cinema.domain.order.exception.OrderConcurrencyConflictException;
import com.sparta.cinema.domain.order.exception.OrderFrozenException;
import com.sparta.cinema.domain.order.exception.RetryBudgetExhaustedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 주문 상태 전이 테스트
 */
@DisplayName("Order 엔티티 테스트")
class OrderTest {

    private static final int MAX_ATTEMPTS = 3;

    private Order order(OrderStatus status, int attemptCount) {
        return Order.builder()
                .orderId("O001")
                .userId("U001")
                .totalAmount(new BigDecimal("19.98"))
                .status(status)
                .attemptCount(attemptCount)
                .build();
    }

    @Nested
    @DisplayName("결제 시작")
    class BeginPaymentAttempt {

        @Test
        @DisplayName("DRAFT 주문은 결제 대기로 바뀌고 순번 1을 받는다")
        void 첫_결제_시작() {
            Order order = order(OrderStatus.DRAFT, 0);

            int sequence = order.beginPaymentAttempt(MAX_ATTEMPTS);

            assertThat(sequence).isEqualTo(1);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.AWAITING_PAYMENT);
            assertThat(order.getAttemptCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("결제 실패 주문은 다음 순번으로 재시도할 수 있다")
        void 재시도() {
            Order order = order(OrderStatus.PAYMENT_FAILED, 2);

            int sequence = order.beginPaymentAttempt(MAX_ATTEMPTS);

            assertThat(sequence).isEqualTo(3);
        }

        @Test
        @DisplayName("이미 결제 대기 중이면 동시 요청 충돌")
        void 결제_대기_중_충돌() {
            Order order = order(OrderStatus.AWAITING_PAYMENT, 1);

            assertThatThrownBy(() -> order.beginPaymentAttempt(MAX_ATTEMPTS))
                    .isInstanceOf(OrderConcurrencyConflictException.class);
        }

        @Test
        @DisplayName("재시도 횟수를 모두 쓰면 실패")
        void 재시도_횟수_초과() {
            Order order = order(OrderStatus.PAYMENT_FAILED, MAX_ATTEMPTS);

            assertThatThrownBy(() -> order.beginPaymentAttempt(MAX_ATTEMPTS))
                    .isInstanceOf(RetryBudgetExhaustedException.class);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PAYMENT_FAILED);
        }

        @Test
        @DisplayName("결제 완료/취소 주문은 결제를 시작할 수 없다")
        void 종결_상태() {
            assertThatThrownBy(() -> order(OrderStatus.PAID, 1).beginPaymentAttempt(MAX_ATTEMPTS))
                    .isInstanceOf(InvalidOrderStatusException.class);
            assertThatThrownBy(() -> order(OrderStatus.CANCELLED, 1).beginPaymentAttempt(MAX_ATTEMPTS))
                    .isInstanceOf(InvalidOrderStatusException.class);
        }

        @Test
        @DisplayName("동결된 주문은 결제를 시작할 수 없다")
        void 동결_주문() {
            Order order = order(OrderStatus.PAYMENT_FAILED, 1);
            order.freeze();

            assertThatThrownBy(() -> order.beginPaymentAttempt(MAX_ATTEMPTS))
                    .isInstanceOf(OrderFrozenException.class);
        }
    }

    @Nested
    @DisplayName("결제 결과 반영")
    class PaymentOutcome {

        @Test
        @DisplayName("결제 완료 시 PAID와 결제 시각이 기록된다")
        void 결제_완료() {
            Order order = order(OrderStatus.AWAITING_PAYMENT, 1);
            LocalDateTime now = LocalDateTime.now();

            order.markPaid(now);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
            assertThat(order.getPaidAt()).isEqualTo(now);
        }

        @Test
        @DisplayName("재시도 횟수가 남아 있으면 PAYMENT_FAILED")
        void 결제_실패_재시도_가능() {
            Order order = order(OrderStatus.AWAITING_PAYMENT, 1);

            OrderStatus result = order.markPaymentFailed(MAX_ATTEMPTS, LocalDateTime.now());

            assertThat(result).isEqualTo(OrderStatus.PAYMENT_FAILED);
            assertThat(order.getCancelledAt()).isNull();
        }

        @Test
        @DisplayName("마지막 시도까지 실패하면 주문이 취소된다")
        void 결제_실패_마지막_시도() {
            Order order = order(OrderStatus.AWAITING_PAYMENT, MAX_ATTEMPTS);

            OrderStatus result = order.markPaymentFailed(MAX_ATTEMPTS, LocalDateTime.now());

            assertThat(result).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.getCancelledAt()).isNotNull();
        }

        @Test
        @DisplayName("결제 대기 상태가 아니면 결제 완료를 반영할 수 없다")
        void 결제_대기_아님() {
            Order order = order(OrderStatus.CANCELLED, 1);

            assertThatThrownBy(() -> order.markPaid(LocalDateTime.now()))
                    .isInstanceOf(InvalidOrderStatusException.class);
        }
    }

    @Nested
    @DisplayName("취소와 환불")
    class CancelAndRefund {

        @Test
        @DisplayName("DRAFT 주문은 취소할 수 있다")
        void 취소() {
            Order order = order(OrderStatus.DRAFT, 0);

            order.cancel(LocalDateTime.now());

            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        @DisplayName("결제 완료 주문은 취소할 수 없다")
        void 결제_완료_취소_불가() {
            Order order = order(OrderStatus.PAID, 1);

            assertThatThrownBy(() -> order.cancel(LocalDateTime.now()))
                    .isInstanceOf(InvalidOrderStatusException.class);
        }

        @Test
        @DisplayName("결제 완료 주문만 환불 상태로 바뀐다")
        void 환불() {
            Order paid = order(OrderStatus.PAID, 1);
            paid.markRefunded();
            assertThat(paid.getStatus()).isEqualTo(OrderStatus.REFUNDED);

            assertThatThrownBy(() -> order(OrderStatus.DRAFT, 0).markRefunded())
                    .isInstanceOf(InvalidOrderStatusException.class);
        }
    }

    @Test
    @DisplayName("다른 사용자의 주문에 접근하면 거부된다")
    void 소유자_검증() {
        Order order = order(OrderStatus.DRAFT, 0);

        assertThatThrownBy(() -> order.validateOwner("U999"))
                .isInstanceOf(OrderAccessDeniedException.class);
    }
}
