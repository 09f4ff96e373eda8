package com.sparta.cinema.application.order.usecase;

import com.sparta.cinema.application.order.dto.OrderSummaryResponse;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 관리자 주문 검색 UseCase
 * 사용자, 상태, 기간(시작일 포함 ~ 종료일 포함)으로 거르고 최신순으로 정렬한다
 */
@Service
@RequiredArgsConstructor
public class SearchOrdersUseCase {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Transactional(readOnly = true)
    public List<OrderSummaryResponse> execute(String userId, OrderStatus status, LocalDate from, LocalDate to) {
        LocalDateTime fromTime = from != null ? from.atStartOfDay() : null;
        LocalDateTime toTime = to != null ? to.plusDays(1).atStartOfDay() : null;

        return GetOrdersUseCase.summarize(
                orderRepository.search(userId, status, fromTime, toTime), orderItemRepository);
    }
}
