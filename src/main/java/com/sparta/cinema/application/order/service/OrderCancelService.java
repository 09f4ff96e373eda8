package com.sparta.cinema.application.order.service;

import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.application.payment.service.PaymentOutcomeApplier;
import com.sparta.cinema.domain.notification.NotificationJobType;
import com.sparta.cinema.domain.notification.NotificationPayload;
import com.sparta.cinema.domain.notification.NotificationQueue;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.ChargeLookup;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 주문 취소 트랜잭션 처리 서비스
 *
 * DRAFT / PAYMENT_FAILED: 바로 취소
 * AWAITING_PAYMENT: 진행 중 시도를 돌려주고, 대행사 조회 결과를 받아 resolveInFlight에서 확정
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderCancelService {

    private final OrderRepository orderRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final PaymentOutcomeApplier paymentOutcomeApplier;
    private final NotificationQueue notificationQueue;

    /**
     * 결제 요청이 나가 있지 않으면 바로 취소한다.
     *
     * @return 결제 대기 중이면 진행 중 시도, 이미 취소했으면 empty
     */
    @Transactional
    public Optional<PaymentAttempt> cancelOrFindInFlight(String orderId, String userId) {
        Order order = lockOrder(orderId);
        order.validateOwner(userId);
        order.ensureNotFrozen();

        if (order.isAwaitingPayment()) {
            Optional<PaymentAttempt> inFlight = paymentAttemptRepository.findFirstByOrderIdAndStatusOrderBySequenceDesc(
                    orderId, PaymentAttemptStatus.PENDING);
            if (inFlight.isPresent()) {
                return inFlight;
            }
        }

        cancel(order);
        return Optional.empty();
    }

    /**
     * 대행사 조회 결과로 결제 대기 주문 취소 확정
     *
     * @param lookup 대행사 조회 결과. 응답을 받지 못했으면 null
     */
    @Transactional
    public CancelOutcome resolveInFlight(String orderId, String attemptId, ChargeLookup lookup) {
        Order order = lockOrder(orderId);
        order.ensureNotFrozen();
        PaymentAttempt attempt = paymentAttemptRepository.findByIdWithLock(attemptId)
                .orElseThrow(() -> new IllegalStateException("결제 시도가 사라졌습니다: " + attemptId));

        // 조회하는 사이 콜백으로 확정된 경우
        if (!attempt.isPending()) {
            if (order.getStatus() == OrderStatus.PAID) {
                return CancelOutcome.PAID;
            }
            cancel(order);
            return CancelOutcome.CANCELLED;
        }

        if (lookup == null) {
            return CancelOutcome.UNRESOLVED;
        }

        LocalDateTime now = LocalDateTime.now();
        return switch (lookup.status()) {
            case SUCCEEDED -> {
                CallbackResult result = paymentOutcomeApplier.applySuccess(order, attempt, lookup.reference());
                yield result == CallbackResult.ANOMALY ? CancelOutcome.UNRESOLVED : CancelOutcome.PAID;
            }
            case NOT_FOUND -> {
                attempt.markExpired(now);
                cancel(order);
                yield CancelOutcome.CANCELLED;
            }
            case FAILED -> {
                attempt.markFailed("취소 중 확인된 대행사 실패", now);
                cancel(order);
                yield CancelOutcome.CANCELLED;
            }
            case PENDING, REFUNDED -> CancelOutcome.UNRESOLVED;
        };
    }

    @Transactional(readOnly = true)
    public Order getOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private void cancel(Order order) {
        order.cancel(LocalDateTime.now());
        notificationQueue.enqueue(NotificationJobType.ORDER_CANCELLED,
                new NotificationPayload(order.getOrderId(), order.getUserId(), order.getTotalAmount(), "사용자 취소"));

        log.info("[Order] 주문 취소 - orderId: {}, userId: {}", order.getOrderId(), order.getUserId());
    }

    private Order lockOrder(String orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    public enum CancelOutcome {
        CANCELLED,
        /**
         * 대행사에서 이미 승인됨 (승인 반영 후 취소 거부)
         */
        PAID,
        /**
         * 결제 결과를 아직 알 수 없음
         */
        UNRESOLVED
    }
}
