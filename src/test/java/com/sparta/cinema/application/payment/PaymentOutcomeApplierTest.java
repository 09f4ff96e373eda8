package com.sparta.cinema.application.payment;

import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.application.payment.service.PaymentOutcomeApplier;
import com.sparta.cinema.domain.notification.NotificationJobType;
import com.sparta.cinema.domain.notification.NotificationQueue;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.payment.AnomalyType;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAnomaly;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.repository.PaymentAnomalyRepository;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("결제 결과 반영 테스트")
class PaymentOutcomeApplierTest {

    @Mock
    private PaymentAttemptRepository paymentAttemptRepository;

    @Mock
    private PaymentAnomalyRepository paymentAnomalyRepository;

    @Mock
    private NotificationQueue notificationQueue;

    private PaymentOutcomeApplier applier;

    @BeforeEach
    void setUp() {
        PaymentPolicy policy = new PaymentPolicy(2, Duration.ofMinutes(15), Duration.ofSeconds(30), Duration.ofMinutes(10));
        applier = new PaymentOutcomeApplier(paymentAttemptRepository, paymentAnomalyRepository, notificationQueue, policy);
    }

    private Order order(OrderStatus status, int attemptCount) {
        return Order.builder()
                .orderId("O001")
                .userId("U001")
                .totalAmount(new BigDecimal("9.99"))
                .status(status)
                .attemptCount(attemptCount)
                .build();
    }

    private PaymentAttempt attempt(String attemptId, int sequence) {
        return PaymentAttempt.builder()
                .attemptId(attemptId)
                .orderId("O001")
                .userId("U001")
                .sequence(sequence)
                .idempotencyKey(PaymentAttempt.idempotencyKey("O001", sequence))
                .amount(new BigDecimal("9.99"))
                .method(PaymentMethod.CARD)
                .build();
    }

    @Test
    @DisplayName("결제 대기 주문의 승인은 주문을 PAID로 바꾸고 알림을 남긴다")
    void 승인_반영() {
        Order order = order(OrderStatus.AWAITING_PAYMENT, 1);
        PaymentAttempt attempt = attempt("A1", 1);
        given(paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot("O001", PaymentAttemptStatus.SUCCEEDED, "A1"))
                .willReturn(false);

        CallbackResult result = applier.applySuccess(order, attempt, "ch_1");

        assertThat(result).isEqualTo(CallbackResult.APPLIED);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.SUCCEEDED);
        assertThat(attempt.getGatewayReference()).isEqualTo("ch_1");
        verify(notificationQueue).enqueue(eq(NotificationJobType.PAYMENT_SUCCEEDED), any());
        verify(paymentAnomalyRepository, never()).save(any());
    }

    @Test
    @DisplayName("다른 시도가 이미 승인된 주문의 승인은 이중 결제로 동결한다")
    void 이중_결제() {
        Order order = order(OrderStatus.PAID, 2);
        PaymentAttempt attempt = attempt("A2", 2);
        given(paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot("O001", PaymentAttemptStatus.SUCCEEDED, "A2"))
                .willReturn(true);

        CallbackResult result = applier.applySuccess(order, attempt, "ch_2");

        assertThat(result).isEqualTo(CallbackResult.ANOMALY);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(order.isFrozen()).isTrue();
        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.REQUIRES_REVIEW);

        ArgumentCaptor<PaymentAnomaly> captor = ArgumentCaptor.forClass(PaymentAnomaly.class);
        verify(paymentAnomalyRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AnomalyType.DOUBLE_PAYMENT);
        assertThat(captor.getValue().getAttemptId()).isEqualTo("A2");
        verify(notificationQueue).enqueue(eq(NotificationJobType.PAYMENT_ANOMALY), any());
    }

    @Test
    @DisplayName("취소된 주문에 승인이 오면 취소 후 결제 이상으로 기록한다")
    void 취소_후_승인() {
        Order order = order(OrderStatus.CANCELLED, 1);
        PaymentAttempt attempt = attempt("A1", 1);
        given(paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot("O001", PaymentAttemptStatus.SUCCEEDED, "A1"))
                .willReturn(false);

        CallbackResult result = applier.applySuccess(order, attempt, "ch_late");

        assertThat(result).isEqualTo(CallbackResult.ANOMALY);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        ArgumentCaptor<PaymentAnomaly> captor = ArgumentCaptor.forClass(PaymentAnomaly.class);
        verify(paymentAnomalyRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AnomalyType.PAYMENT_AFTER_CANCEL);
    }

    @Test
    @DisplayName("재시도 횟수가 남은 실패는 PAYMENT_FAILED 알림")
    void 실패_재시도_가능() {
        Order order = order(OrderStatus.AWAITING_PAYMENT, 1);
        PaymentAttempt attempt = attempt("A1", 1);

        applier.applyFailure(order, attempt, "card_declined");

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAYMENT_FAILED);
        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.FAILED);
        assertThat(attempt.getFailureReason()).isEqualTo("card_declined");
        verify(notificationQueue).enqueue(eq(NotificationJobType.PAYMENT_FAILED), any());
    }

    @Test
    @DisplayName("마지막 시도의 실패는 주문을 취소하고 ORDER_CANCELLED 알림")
    void 실패_마지막_시도() {
        Order order = order(OrderStatus.AWAITING_PAYMENT, 2);
        PaymentAttempt attempt = attempt("A2", 2);

        applier.applyFailure(order, attempt, "card_declined");

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        verify(notificationQueue).enqueue(eq(NotificationJobType.ORDER_CANCELLED), any());
    }

    @Test
    @DisplayName("결제 대기 상태가 아닌 주문의 실패는 시도만 기록한다")
    void 실패_주문_상태_유지() {
        Order order = order(OrderStatus.CANCELLED, 1);
        PaymentAttempt attempt = attempt("A1", 1);

        applier.applyFailure(order, attempt, "expired");

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.FAILED);
        verify(notificationQueue, never()).enqueue(any(), any());
    }

    @Test
    @DisplayName("대행사에 기록이 없는 시도는 EXPIRED로 남기고 주문에는 실패로 반영한다")
    void 만료_반영() {
        Order order = order(OrderStatus.AWAITING_PAYMENT, 1);
        PaymentAttempt attempt = attempt("A1", 1);

        applier.applyExpiry(order, attempt, "대사 결과: 대행사에 결제 기록 없음");

        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.EXPIRED);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAYMENT_FAILED);
        verify(notificationQueue).enqueue(eq(NotificationJobType.PAYMENT_FAILED), any());
    }

    @Test
    @DisplayName("만료 처리한 시도가 뒤늦게 승인되면 주문이 결제 전이어도 동결하고 이상으로 기록한다")
    void 만료_후_승인() {
        Order order = order(OrderStatus.AWAITING_PAYMENT, 1);
        PaymentAttempt attempt = attempt("A1", 1);
        applier.applyExpiry(order, attempt, "대사 결과: 대행사에 결제 기록 없음");
        given(paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot("O001", PaymentAttemptStatus.SUCCEEDED, "A1"))
                .willReturn(false);

        CallbackResult result = applier.applyLateSuccess(order, attempt, "ch_late");

        assertThat(result).isEqualTo(CallbackResult.ANOMALY);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAYMENT_FAILED);
        assertThat(order.isFrozen()).isTrue();
        assertThat(attempt.getStatus()).isEqualTo(PaymentAttemptStatus.REQUIRES_REVIEW);
        assertThat(attempt.getGatewayReference()).isEqualTo("ch_late");

        ArgumentCaptor<PaymentAnomaly> captor = ArgumentCaptor.forClass(PaymentAnomaly.class);
        verify(paymentAnomalyRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AnomalyType.LATE_PAYMENT);
        verify(notificationQueue).enqueue(eq(NotificationJobType.PAYMENT_ANOMALY), any());
    }

    @Test
    @DisplayName("재시도로 결제 완료된 주문에 이전 시도의 승인이 오면 이중 결제로 기록한다")
    void 재시도_완료_후_이전_시도_승인() {
        Order order = order(OrderStatus.PAID, 2);
        PaymentAttempt attempt = attempt("A1", 1);
        attempt.markFailed("대사 결과: 대행사 실패", LocalDateTime.now());
        given(paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot("O001", PaymentAttemptStatus.SUCCEEDED, "A1"))
                .willReturn(true);

        CallbackResult result = applier.applyLateSuccess(order, attempt, "ch_1");

        assertThat(result).isEqualTo(CallbackResult.ANOMALY);
        ArgumentCaptor<PaymentAnomaly> captor = ArgumentCaptor.forClass(PaymentAnomaly.class);
        verify(paymentAnomalyRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(AnomalyType.DOUBLE_PAYMENT);
    }
}
