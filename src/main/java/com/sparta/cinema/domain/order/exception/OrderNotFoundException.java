package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외
 */
public class OrderNotFoundException extends BusinessException {
    public OrderNotFoundException(String orderId) {
        super(ErrorCode.O001, "주문을 찾을 수 없습니다: " + orderId);
    }
}
