package com.sparta.cinema.application.payment.service;

import com.sparta.cinema.application.payment.PaymentPolicy;
import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.application.payment.dto.ReconcileOutcome;
import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.ChargeLookup;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 결제 대사 트랜잭션 처리 서비스
 *
 * 대행사 조회는 트랜잭션 밖(ReconcileStaleUseCase)에서 하고,
 * 조회 결과는 주문 잠금 아래에서 시도가 아직 PENDING일 때만 반영한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final OrderRepository orderRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final PaymentOutcomeApplier paymentOutcomeApplier;
    private final PaymentPolicy paymentPolicy;

    /**
     * 결제 대기 중인 주문의 진행 중 시도
     */
    @Transactional(readOnly = true)
    public Optional<PaymentAttempt> findInFlightAttempt(String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isAwaitingPayment()) {
            return Optional.empty();
        }
        return paymentAttemptRepository.findFirstByOrderIdAndStatusOrderBySequenceDesc(
                orderId, PaymentAttemptStatus.PENDING);
    }

    /**
     * 시도가 stale-after보다 오래 결제 대기 중인지
     */
    public boolean isStale(PaymentAttempt attempt, LocalDateTime now) {
        LocalDateTime createdAt = attempt.getCreatedAt();
        return createdAt != null && !createdAt.isAfter(now.minus(paymentPolicy.getStaleAfter()));
    }

    /**
     * 오래 머문 PENDING 시도 목록 (스케줄러용)
     */
    @Transactional(readOnly = true)
    public List<PaymentAttempt> findStaleAttempts(int limit) {
        LocalDateTime now = LocalDateTime.now();
        return paymentAttemptRepository.findStalePending(
                now.minus(paymentPolicy.getStaleAfter()), now, PageRequest.of(0, limit));
    }

    /**
     * 대행사 조회 결과 반영
     *
     * @param lookup 대행사 조회 결과. 응답을 받지 못했으면 null
     */
    @Transactional
    public ReconcileResponse apply(String orderId, String attemptId, ChargeLookup lookup) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        PaymentAttempt attempt = paymentAttemptRepository.findByIdWithLock(attemptId)
                .orElseThrow(() -> new IllegalStateException("결제 시도가 사라졌습니다: " + attemptId));

        if (!attempt.isPending()) {
            log.info("[Reconcile] 조회 중 이미 확정됨 - orderId: {}, attemptId: {}, status: {}",
                    orderId, attemptId, attempt.getStatus());
            return response(order, ReconcileOutcome.NOTHING_TO_RECONCILE);
        }

        if (lookup == null) {
            return postpone(order, attempt, "대행사 응답 없음");
        }

        return switch (lookup.status()) {
            case SUCCEEDED -> {
                CallbackResult result = paymentOutcomeApplier.applySuccess(order, attempt, lookup.reference());
                yield response(order, result == CallbackResult.ANOMALY ? ReconcileOutcome.ANOMALY : ReconcileOutcome.SUCCEEDED);
            }
            case FAILED -> {
                paymentOutcomeApplier.applyFailure(order, attempt, "대사 결과: 대행사 실패");
                yield response(order, ReconcileOutcome.FAILED);
            }
            case NOT_FOUND -> {
                paymentOutcomeApplier.applyExpiry(order, attempt, "대사 결과: 대행사에 결제 기록 없음");
                yield response(order, ReconcileOutcome.FAILED);
            }
            case PENDING, REFUNDED -> postpone(order, attempt, "대행사 상태: " + lookup.status());
        };
    }

    private ReconcileResponse postpone(Order order, PaymentAttempt attempt, String reason) {
        attempt.scheduleNextReconcile(LocalDateTime.now(),
                paymentPolicy.getReconcileBackoffBase(), paymentPolicy.getReconcileBackoffCap());

        log.warn("[Reconcile] 결과 미확정, 연기 - orderId: {}, attemptId: {}, count: {}, next: {}, reason: {}",
                order.getOrderId(), attempt.getAttemptId(), attempt.getReconcileCount(),
                attempt.getNextReconcileAt(), reason);
        return response(order, ReconcileOutcome.STILL_PENDING);
    }

    private ReconcileResponse response(Order order, ReconcileOutcome outcome) {
        return new ReconcileResponse(order.getOrderId(), order.getStatus(), outcome);
    }
}
