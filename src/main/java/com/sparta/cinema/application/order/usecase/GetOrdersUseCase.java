package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderSummaryResponse;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.entity.OrderItem;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 사용자 주문 목록 조회 UseCase (최신순)
 */
@Service
@RequiredArgsConstructor
public class GetOrdersUseCase {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Transactional(readOnly = true)
    public List<OrderSummaryResponse> execute(String userId) {
        return summarize(orderRepository.findByUserIdOrderByCreatedAtDesc(userId), orderItemRepository);
    }

    static List<OrderSummaryResponse> summarize(List<Order> orders, OrderItemRepository orderItemRepository) {
        if (orders.isEmpty()) {
            return List.of();
        }

        Map<String, Long> itemCounts = orderItemRepository.findByOrderIdIn(
                        orders.stream().map(Order::getOrderId).toList()).stream()
                .collect(Collectors.groupingBy(OrderItem::getOrderId, Collectors.counting()));

        return orders.stream()
                .map(order -> OrderSummaryResponse.from(order,
                        itemCounts.getOrDefault(order.getOrderId(), 0L).intValue()))
                .toList();
    }
}
