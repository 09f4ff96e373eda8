package com.sparta.cinema.application.payment.usecase;

import com.sparta.cinema.application.payment.dto.ReconcileOutcome;
import com.sparta.cinema.application.payment.dto.ReconcileResponse;
import com.sparta.cinema.application.payment.service.ReconciliationService;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.ChargeLookup;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 결제 대사 유스케이스
 *
 * 결제 대기 주문의 진행 중 시도를 멱등성 키로 대행사에 조회해 결과를 확정한다.
 * 관리자 API와 StalePaymentReconciler 스케줄러가 호출한다.
 * 시도가 stale-after보다 오래되지 않았으면 force 없이는 대행사에 조회하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconcileStaleUseCase {

    private final ReconciliationService reconciliationService;
    private final PaymentGateway paymentGateway;
    private final OrderRepository orderRepository;

    @Trace
    @DistributedLock(key = "'order:' + #orderId", waitTime = 0L, leaseTime = 30L)
    public ReconcileResponse execute(String orderId, boolean force) {
        Optional<PaymentAttempt> inFlight = reconciliationService.findInFlightAttempt(orderId);
        if (inFlight.isEmpty()) {
            return orderRepository.findById(orderId)
                    .map(order -> new ReconcileResponse(orderId, order.getStatus(), ReconcileOutcome.NOTHING_TO_RECONCILE))
                    .orElseThrow(() -> new OrderNotFoundException(orderId));
        }

        PaymentAttempt attempt = inFlight.get();
        if (!force && !reconciliationService.isStale(attempt, LocalDateTime.now())) {
            log.info("[Reconcile] 대사 대상 시간 전 - orderId: {}, attemptId: {}, createdAt: {}",
                    orderId, attempt.getAttemptId(), attempt.getCreatedAt());
            return new ReconcileResponse(orderId, OrderStatus.AWAITING_PAYMENT, ReconcileOutcome.NOT_STALE);
        }

        ChargeLookup lookup;
        try {
            lookup = paymentGateway.lookup(attempt.getIdempotencyKey());
        } catch (GatewayTimeoutException e) {
            log.warn("[Reconcile] 대행사 조회 실패 - orderId: {}, idempotencyKey: {}, cause: {}",
                    orderId, attempt.getIdempotencyKey(), e.getMessage());
            lookup = null;
        }

        return reconciliationService.apply(orderId, attempt.getAttemptId(), lookup);
    }
}
