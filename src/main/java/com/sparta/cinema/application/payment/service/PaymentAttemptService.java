package com.sparta.cinema.application.payment.service;

import com.sparta.cinema.application.payment.PaymentPolicy;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.ChargeHandle;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 결제 시작 트랜잭션 처리 서비스
 *
 * 대행사 호출은 트랜잭션 밖에서 하므로 결제 시작은 세 단계로 나뉜다.
 * 1단계 open: 주문 잠금 → 시도 생성 → AWAITING_PAYMENT
 * 2단계: 대행사 호출 (InitiateChargeUseCase)
 * 3단계 recordAccepted / recordDeclined / recordUnknown
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentAttemptService {

    private final OrderRepository orderRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final PaymentOutcomeApplier paymentOutcomeApplier;
    private final PaymentPolicy paymentPolicy;

    @Transactional
    public PaymentAttempt open(String orderId, String userId, PaymentMethod method) {
        Order order = lockOrder(orderId);
        order.validateOwner(userId);

        int sequence = order.beginPaymentAttempt(paymentPolicy.getMaxAttempts());
        PaymentAttempt attempt = paymentAttemptRepository.save(
                PaymentAttempt.start(orderId, userId, sequence, order.getTotalAmount(), method));

        log.info("[Payment] 결제 시도 생성 - orderId: {}, sequence: {}, idempotencyKey: {}",
                orderId, sequence, attempt.getIdempotencyKey());
        return attempt;
    }

    @Transactional
    public PaymentAttempt recordAccepted(String orderId, String attemptId, ChargeHandle handle) {
        lockOrder(orderId);
        PaymentAttempt attempt = getAttempt(attemptId);
        attempt.recordGatewayAcceptance(handle.reference(), handle.redirectUrl());

        log.info("[Payment] 대행사 접수 - attemptId: {}, reference: {}", attemptId, handle.reference());
        return attempt;
    }

    @Transactional
    public void recordDeclined(String orderId, String attemptId, String reason) {
        Order order = lockOrder(orderId);
        PaymentAttempt attempt = getAttempt(attemptId);

        if (!attempt.isPending()) {
            log.warn("[Payment] 이미 종결된 시도의 거절 응답 무시 - attemptId: {}, status: {}",
                    attemptId, attempt.getStatus());
            return;
        }
        paymentOutcomeApplier.applyFailure(order, attempt, reason);
    }

    /**
     * 대행사 응답 없음. 시도는 PENDING으로 두고 첫 대사 시각만 잡는다.
     */
    @Transactional
    public PaymentAttempt recordUnknown(String orderId, String attemptId) {
        lockOrder(orderId);
        PaymentAttempt attempt = getAttempt(attemptId);
        if (attempt.isPending()) {
            attempt.scheduleNextReconcile(LocalDateTime.now(),
                    paymentPolicy.getReconcileBackoffBase(), paymentPolicy.getReconcileBackoffCap());
        }
        return attempt;
    }

    /**
     * 콜백과 같은 시도를 동시에 고치지 않도록 항상 주문 행 잠금을 먼저 잡는다
     */
    private Order lockOrder(String orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private PaymentAttempt getAttempt(String attemptId) {
        return paymentAttemptRepository.findByIdWithLock(attemptId)
                .orElseThrow(() -> new IllegalStateException("결제 시도가 사라졌습니다: " + attemptId));
    }
}
