package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 같은 주문에 대한 결제 시작이 동시에 들어왔을 때 늦은 쪽에 발생하는 예외
 */
public class OrderConcurrencyConflictException extends BusinessException {
    public OrderConcurrencyConflictException(String orderId) {
        super(ErrorCode.O008, "이미 결제가 진행 중인 주문입니다: " + orderId);
    }
}
