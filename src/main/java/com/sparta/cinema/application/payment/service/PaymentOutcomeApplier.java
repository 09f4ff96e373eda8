package com.sparta.cinema.application.payment.service;

import com.sparta.cinema.application.payment.PaymentPolicy;
import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.domain.notification.NotificationJobType;
import com.sparta.cinema.domain.notification.NotificationPayload;
import com.sparta.cinema.domain.notification.NotificationQueue;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.payment.AnomalyType;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAnomaly;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.repository.PaymentAnomalyRepository;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 확정된 결제 결과를 주문/결제 시도에 반영
 *
 * 콜백, 대사, 취소, 환불 흐름이 모두 이 클래스를 거친다.
 * 호출자는 주문 행 잠금을 잡은 트랜잭션 안에서 호출해야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class PaymentOutcomeApplier {

    private final PaymentAttemptRepository paymentAttemptRepository;
    private final PaymentAnomalyRepository paymentAnomalyRepository;
    private final NotificationQueue notificationQueue;
    private final PaymentPolicy paymentPolicy;

    /**
     * 결제 승인 반영
     *
     * 다른 시도가 이미 승인되었거나 주문이 결제 대기 상태가 아니면 이중 결제로 보고
     * 시도를 REQUIRES_REVIEW로, 주문을 동결 상태로 만든다. 자동 환불은 하지 않는다.
     */
    public CallbackResult applySuccess(Order order, PaymentAttempt attempt, String gatewayReference) {
        LocalDateTime now = LocalDateTime.now();
        boolean alreadyPaid = hasOtherSucceededAttempt(order, attempt);

        if (alreadyPaid || order.isFrozen() || !order.isAwaitingPayment()) {
            recordAnomaly(order, attempt, gatewayReference, classify(order, alreadyPaid), now);
            return CallbackResult.ANOMALY;
        }

        attempt.markSucceeded(gatewayReference, now);
        order.markPaid(now);
        notificationQueue.enqueue(NotificationJobType.PAYMENT_SUCCEEDED, payload(order, null));

        log.info("[Payment] 결제 완료 - orderId: {}, attemptId: {}, reference: {}",
                order.getOrderId(), attempt.getAttemptId(), attempt.getGatewayReference());
        return CallbackResult.APPLIED;
    }

    /**
     * 실패/만료로 정리한 시도에 승인이 확인된 경우
     *
     * 주문이 이미 다음 시도로 넘어갔을 수 있으므로 주문 상태와 관계없이 결제 이상으로 기록하고 동결한다.
     */
    public CallbackResult applyLateSuccess(Order order, PaymentAttempt attempt, String gatewayReference) {
        boolean alreadyPaid = hasOtherSucceededAttempt(order, attempt);
        recordAnomaly(order, attempt, gatewayReference, classify(order, alreadyPaid), LocalDateTime.now());
        return CallbackResult.ANOMALY;
    }

    /**
     * 결제 실패 반영. 재시도 횟수가 남아 있지 않으면 주문은 취소된다.
     */
    public void applyFailure(Order order, PaymentAttempt attempt, String reason) {
        LocalDateTime now = LocalDateTime.now();
        attempt.markFailed(reason, now);
        failOrder(order, attempt, reason, now);
    }

    /**
     * 대행사에 결제 기록이 없는 시도 정리. 주문에는 실패와 같이 반영한다.
     * 시도는 EXPIRED로 남겨 뒤늦은 승인을 결제 이상으로 잡는다.
     */
    public void applyExpiry(Order order, PaymentAttempt attempt, String reason) {
        LocalDateTime now = LocalDateTime.now();
        attempt.markExpired(now);
        failOrder(order, attempt, reason, now);
    }

    private void failOrder(Order order, PaymentAttempt attempt, String reason, LocalDateTime now) {
        if (order.isFrozen() || !order.isAwaitingPayment()) {
            log.warn("[Payment] 결제 대기 상태가 아닌 주문의 실패 통보 - orderId: {}, status: {}, attemptId: {}",
                    order.getOrderId(), order.getStatus(), attempt.getAttemptId());
            return;
        }

        OrderStatus result = order.markPaymentFailed(paymentPolicy.getMaxAttempts(), now);
        NotificationJobType jobType = result == OrderStatus.CANCELLED
                ? NotificationJobType.ORDER_CANCELLED
                : NotificationJobType.PAYMENT_FAILED;
        notificationQueue.enqueue(jobType, payload(order, reason));

        log.info("[Payment] 결제 실패 - orderId: {}, attempt: {}/{}, orderStatus: {}, reason: {}",
                order.getOrderId(), order.getAttemptCount(), paymentPolicy.getMaxAttempts(), result, reason);
    }

    /**
     * 환불 완료 반영
     */
    public void applyRefund(Order order, PaymentAttempt attempt) {
        attempt.markRefunded(LocalDateTime.now());
        order.markRefunded();
        notificationQueue.enqueue(NotificationJobType.ORDER_REFUNDED, payload(order, null));

        log.info("[Payment] 환불 완료 - orderId: {}, attemptId: {}", order.getOrderId(), attempt.getAttemptId());
    }

    private boolean hasOtherSucceededAttempt(Order order, PaymentAttempt attempt) {
        return paymentAttemptRepository.existsByOrderIdAndStatusAndAttemptIdNot(
                order.getOrderId(), PaymentAttemptStatus.SUCCEEDED, attempt.getAttemptId());
    }

    private AnomalyType classify(Order order, boolean alreadyPaid) {
        if (order.getStatus() == OrderStatus.CANCELLED) {
            return AnomalyType.PAYMENT_AFTER_CANCEL;
        }
        if (alreadyPaid || order.getStatus() == OrderStatus.PAID || order.getStatus() == OrderStatus.REFUNDED) {
            return AnomalyType.DOUBLE_PAYMENT;
        }
        return AnomalyType.LATE_PAYMENT;
    }

    private void recordAnomaly(Order order, PaymentAttempt attempt, String gatewayReference,
                               AnomalyType type, LocalDateTime now) {
        String detail = String.format("%s - orderStatus: %s, attempt: %d, reference: %s, amount: %s",
                type, order.getStatus(), attempt.getSequence(), gatewayReference, attempt.getAmount());

        attempt.markRequiresReview(gatewayReference, type.name(), now);
        order.freeze();
        paymentAnomalyRepository.save(PaymentAnomaly.builder()
                .orderId(order.getOrderId())
                .attemptId(attempt.getAttemptId())
                .type(type)
                .detail(detail)
                .detectedAt(now)
                .build());
        notificationQueue.enqueue(NotificationJobType.PAYMENT_ANOMALY, payload(order, detail));

        log.error("[Payment] 결제 이상 감지, 주문 동결 - orderId: {}, attemptId: {}, {}",
                order.getOrderId(), attempt.getAttemptId(), detail);
    }

    private NotificationPayload payload(Order order, String detail) {
        return new NotificationPayload(order.getOrderId(), order.getUserId(), order.getTotalAmount(), detail);
    }
}
