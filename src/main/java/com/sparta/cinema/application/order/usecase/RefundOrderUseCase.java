package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.order.service.RefundService;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.exception.PaymentGatewayException;
import com.sparta.cinema.domain.payment.gateway.GatewayChargeStatus;
import com.sparta.cinema.domain.payment.gateway.GatewayTimeoutException;
import com.sparta.cinema.domain.payment.gateway.PaymentGateway;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 주문 환불 유스케이스
 * PAID 주문의 승인 결제를 대행사에서 환불하고 주문을 REFUNDED로 바꾼다
 */
@Service
@RequiredArgsConstructor
public class RefundOrderUseCase {

    private final RefundService refundService;
    private final PaymentGateway paymentGateway;
    private final OrderItemRepository orderItemRepository;

    @Trace
    @DistributedLock(key = "'order:' + #orderId", leaseTime = 30L)
    public OrderResponse execute(String orderId, String userId) {
        PaymentAttempt attempt = refundService.findRefundableAttempt(orderId, userId);

        GatewayChargeStatus status;
        try {
            status = paymentGateway.refund(attempt.getGatewayReference(), attempt.getAmount());
        } catch (GatewayTimeoutException e) {
            throw new PaymentGatewayException("환불 결과를 확인하지 못했습니다: " + orderId, e);
        }
        if (status != GatewayChargeStatus.REFUNDED) {
            throw new PaymentGatewayException("대행사가 환불을 완료하지 않았습니다 - orderId: " + orderId + ", status: " + status);
        }

        Order order = refundService.complete(orderId, attempt.getAttemptId());
        return OrderResponse.from(order, orderItemRepository.findByOrderId(orderId));
    }
}
