package com.sparta.cinema.application.payment.usecase;

import com.sparta.cinema.application.payment.dto.PaymentHandleResponse;
import com.sparta.cinema.application.payment.dto.PaymentHandleStatus;
import com.sparta.cinema.application.payment.service.PaymentAttemptService;
import com.sparta.cinema.domain.payment.PaymentMethod;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.exception.PaymentDeclinedException;
import com.sparta.cinema.domain.payment.gateway.ChargeHandle;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 결제 시작 유스케이스
 *
 * 동시성 제어 전략:
 * - 락 키: "lock:order:{orderId}", 대기 없이 시도 (늦은 요청은 즉시 409)
 * - 락을 통과해도 주문 행 잠금 아래에서 상태를 다시 확인한다 (AWAITING_PAYMENT면 409)
 *
 * 대행사 호출은 트랜잭션 밖에서 이루어지며, 응답을 받지 못하면 거절로 보지 않고
 * UNKNOWN을 돌려준 뒤 콜백이나 대사로 결과를 확정한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InitiateChargeUseCase {

    private final PaymentAttemptService paymentAttemptService;
    private final PaymentGateway paymentGateway;

    @Trace
    @DistributedLock(key = "'order:' + #orderId", waitTime = 0L, leaseTime = 30L)
    public PaymentHandleResponse execute(String orderId, String userId, PaymentMethod method) {
        // 1. 시도 생성 + 주문 AWAITING_PAYMENT (트랜잭션)
        PaymentAttempt attempt = paymentAttemptService.open(orderId, userId, method);

        // 2. 대행사 호출 (트랜잭션 밖)
        ChargeHandle handle;
        try {
            handle = paymentGateway.charge(attempt.getIdempotencyKey(), attempt.getAmount(), method);
        } catch (GatewayTimeoutException e) {
            log.warn("[Payment] 대행사 응답 없음, 대사 대상 - orderId: {}, idempotencyKey: {}, cause: {}",
                    orderId, attempt.getIdempotencyKey(), e.getMessage());
            PaymentAttempt unknown = paymentAttemptService.recordUnknown(orderId, attempt.getAttemptId());
            return PaymentHandleResponse.of(unknown, PaymentHandleStatus.UNKNOWN);
        } catch (PaymentDeclinedException e) {
            paymentAttemptService.recordDeclined(orderId, attempt.getAttemptId(), e.getReason());
            throw e;
        }

        // 3. 접수 결과 기록 (트랜잭션)
        PaymentAttempt accepted = paymentAttemptService.recordAccepted(orderId, attempt.getAttemptId(), handle);
        return PaymentHandleResponse.of(accepted, PaymentHandleStatus.PENDING);
    }
}
