package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderDetailResponse;
import com.sparta.cinema.application.order.dto.OrderResponse;
import com.sparta.cinema.application.payment.dto.PaymentAttemptResponse;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.exception.OrderNotFoundException;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 상세 조회 UseCase (주문 항목 + 결제 시도 이력)
 */
@Service
@RequiredArgsConstructor
public class GetOrderDetailUseCase {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;

    @Transactional(readOnly = true)
    public OrderDetailResponse execute(String orderId, String userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        order.validateOwner(userId);

        return new OrderDetailResponse(
                OrderResponse.from(order, orderItemRepository.findByOrderId(orderId)),
                paymentAttemptRepository.findByOrderIdOrderBySequenceAsc(orderId).stream()
                        .map(PaymentAttemptResponse::from)
                        .toList()
        );
    }
}
