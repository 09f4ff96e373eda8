package com.sparta.cinema.application.payment.service;

import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.application.payment.dto.PaymentCallbackRequest;
import com.sparta.cinema.domain.inbox.MessageSource;
import com.sparta.cinema.domain.inbox.entity.ProcessedMessage;
import com.sparta.cinema.domain.inbox.repository.ProcessedMessageRepository;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.exception.PaymentAttemptNotFoundException;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 결제 콜백 처리 서비스
 *
 * 대행사는 같은 콜백을 여러 번, 순서 없이 보낼 수 있다.
 * - eventId로 한 번 걸러내고 (ProcessedMessage)
 * - 이미 종결된 시도에 대한 통보는 상태를 바꾸지 않는다
 * - 실패/만료로 정리된 시도의 승인 통보는 결제 이상으로 기록한다
 *
 * 잠금 전에 일반 조회를 하므로 READ_COMMITTED로 실행한다.
 * REPEATABLE_READ에서는 첫 조회 시점의 스냅샷이 고정되어 잠금 이후에도 다른 트랜잭션이 커밋한 시도 상태를 보지 못한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentCallbackService {

    private final ProcessedMessageRepository processedMessageRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final OrderRepository orderRepository;
    private final PaymentOutcomeApplier paymentOutcomeApplier;

    @Transactional(isolation = Isolation.READ_COMMITTED)
    public CallbackResult handle(PaymentCallbackRequest callback) {
        // 1. 이벤트 중복 확인
        if (processedMessageRepository.existsById(callback.eventId())) {
            log.warn("[Callback] 중복 이벤트 무시 - eventId: {}", callback.eventId());
            return CallbackResult.DUPLICATE;
        }

        // 2. 결제 시도 위치 확인 후 주문 잠금, 잠금 아래에서 시도를 잠금 읽기로 다시 읽는다
        String attemptId = locateAttemptId(callback);
        String orderId = paymentAttemptRepository.findOrderIdByAttemptId(attemptId)
                .orElseThrow(() -> new PaymentAttemptNotFoundException(callback.gatewayReference(), callback.idempotencyKey()));
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        PaymentAttempt attempt = paymentAttemptRepository.findByIdWithLock(attemptId)
                .orElseThrow(() -> new PaymentAttemptNotFoundException(callback.gatewayReference(), callback.idempotencyKey()));

        processedMessageRepository.save(new ProcessedMessage(callback.eventId(), MessageSource.PAYMENT_CALLBACK));

        // 3. 결과 반영
        CallbackResult result = switch (callback.outcome()) {
            case SUCCEEDED -> handleSucceeded(order, attempt, callback);
            case FAILED -> handleFailed(order, attempt, callback);
            case REFUNDED -> handleRefunded(order, attempt, callback);
        };

        log.info("[Callback] 처리 완료 - eventId: {}, orderId: {}, outcome: {}, result: {}",
                callback.eventId(), order.getOrderId(), callback.outcome(), result);
        return result;
    }

    private CallbackResult handleSucceeded(Order order, PaymentAttempt attempt, PaymentCallbackRequest callback) {
        if (attempt.isPending()) {
            return paymentOutcomeApplier.applySuccess(order, attempt, callback.gatewayReference());
        }
        // 취소나 대사에서 실패/만료로 정리한 시도에 실제 승인이 있었던 경우
        if (attempt.getStatus() == PaymentAttemptStatus.EXPIRED || attempt.getStatus() == PaymentAttemptStatus.FAILED) {
            return paymentOutcomeApplier.applyLateSuccess(order, attempt, callback.gatewayReference());
        }
        return duplicate(attempt, callback);
    }

    private CallbackResult handleFailed(Order order, PaymentAttempt attempt, PaymentCallbackRequest callback) {
        if (!attempt.isPending()) {
            return duplicate(attempt, callback);
        }
        String reason = callback.failureReason() != null ? callback.failureReason() : "대행사 결제 실패";
        paymentOutcomeApplier.applyFailure(order, attempt, reason);
        return CallbackResult.APPLIED;
    }

    private CallbackResult handleRefunded(Order order, PaymentAttempt attempt, PaymentCallbackRequest callback) {
        if (attempt.getStatus() != PaymentAttemptStatus.SUCCEEDED || order.isFrozen()) {
            return duplicate(attempt, callback);
        }
        paymentOutcomeApplier.applyRefund(order, attempt);
        return CallbackResult.APPLIED;
    }

    private CallbackResult duplicate(PaymentAttempt attempt, PaymentCallbackRequest callback) {
        log.warn("[Callback] 이미 종결된 결제 시도 - eventId: {}, attemptId: {}, status: {}, outcome: {}",
                callback.eventId(), attempt.getAttemptId(), attempt.getStatus(), callback.outcome());
        return CallbackResult.DUPLICATE;
    }

    /**
     * 참조번호 우선, 없으면 멱등성 키로 찾는다 (3단계 기록 전에 콜백이 먼저 온 경우)
     */
    private String locateAttemptId(PaymentCallbackRequest callback) {
        Optional<String> byReference = Optional.ofNullable(callback.gatewayReference())
                .filter(reference -> !reference.isBlank())
                .flatMap(paymentAttemptRepository::findAttemptIdByGatewayReference);

        return byReference
                .or(() -> Optional.ofNullable(callback.idempotencyKey())
                        .filter(key -> !key.isBlank())
                        .flatMap(paymentAttemptRepository::findAttemptIdByIdempotencyKey))
                .orElseThrow(() -> new PaymentAttemptNotFoundException(
                        callback.gatewayReference(), callback.idempotencyKey()));
    }
}
