package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;
import com.sparta.cinema.domain.order.OrderStatus;

/**
 * 현재 주문 상태에서 허용되지 않는 전이를 요청할 때 발생하는 예외
 */
public class InvalidOrderStatusException extends BusinessException {
    public InvalidOrderStatusException(String orderId, OrderStatus status, String action) {
        super(ErrorCode.O002,
                String.format("%s 상태의 주문은 %s 처리할 수 없습니다: %s", status, action, orderId));
    }
}
