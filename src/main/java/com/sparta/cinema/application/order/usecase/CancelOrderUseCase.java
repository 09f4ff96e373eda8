package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.order.service.OrderCancelService;
import com.sparta.cinema.application.order.service.OrderCancelService.CancelOutcome;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.CancellationNotAllowedException;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.gateway.ChargeLookup;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 주문 취소 유스케이스
 *
 * 결제 대기 중인 주문은 대행사에 먼저 결제 여부를 확인한다.
 * 이미 승인된 결제가 확인되면 결제 완료를 반영하고 취소는 거부한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CancelOrderUseCase {

    private final OrderCancelService orderCancelService;
    private final PaymentGateway paymentGateway;
    private final OrderItemRepository orderItemRepository;

    @Trace
    @DistributedLock(key = "'order:' + #orderId", leaseTime = 30L)
    public OrderResponse execute(String orderId, String userId) {
        Optional<PaymentAttempt> inFlight = orderCancelService.cancelOrFindInFlight(orderId, userId);

        if (inFlight.isPresent()) {
            PaymentAttempt attempt = inFlight.get();
            CancelOutcome outcome = orderCancelService.resolveInFlight(
                    orderId, attempt.getAttemptId(), lookup(attempt));

            if (outcome == CancelOutcome.PAID) {
                throw new CancellationNotAllowedException(orderId, "이미 결제가 승인됨");
            }
            if (outcome == CancelOutcome.UNRESOLVED) {
                throw new CancellationNotAllowedException(orderId, "결제 결과 확인 중");
            }
        }

        Order order = orderCancelService.getOrder(orderId);
        return OrderResponse.from(order, orderItemRepository.findByOrderId(orderId));
    }

    private ChargeLookup lookup(PaymentAttempt attempt) {
        try {
            return paymentGateway.lookup(attempt.getIdempotencyKey());
        } catch (GatewayTimeoutException e) {
            log.warn("[Order] 취소 전 대행사 조회 실패 - orderId: {}, cause: {}", attempt.getOrderId(), e.getMessage());
            return null;
        }
    }
}
