package com.sparta.cinema.application.order.service;

import com.sparta.cinema.application.payment.service.PaymentOutcomeApplier;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.InvalidOrderStatusException;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 환불 트랜잭션 처리 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundService {

    private final OrderRepository orderRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final PaymentOutcomeApplier paymentOutcomeApplier;

    /**
     * 환불 대상 결제 시도 조회 (결제 완료 + 동결되지 않은 주문)
     */
    @Transactional(readOnly = true)
    public PaymentAttempt findRefundableAttempt(String orderId, String userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        order.validateOwner(userId);
        order.ensureNotFrozen();
        if (order.getStatus() != OrderStatus.PAID) {
            throw new InvalidOrderStatusException(orderId, order.getStatus(), "환불");
        }

        return paymentAttemptRepository.findFirstByOrderIdAndStatus(orderId, PaymentAttemptStatus.SUCCEEDED)
                .orElseThrow(() -> new IllegalStateException("결제 완료 주문에 승인된 결제 시도가 없습니다: " + orderId));
    }

    /**
     * 대행사 환불 성공 반영. 환불 콜백이 먼저 반영했으면 아무것도 하지 않는다.
     */
    @Transactional
    public Order complete(String orderId, String attemptId) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        PaymentAttempt attempt = paymentAttemptRepository.findByIdWithLock(attemptId)
                .orElseThrow(() -> new IllegalStateException("결제 시도가 사라졌습니다: " + attemptId));

        if (order.getStatus() == OrderStatus.REFUNDED) {
            log.info("[Order] 이미 환불 반영됨 - orderId: {}", orderId);
            return order;
        }

        paymentOutcomeApplier.applyRefund(order, attempt);
        return order;
    }
}
