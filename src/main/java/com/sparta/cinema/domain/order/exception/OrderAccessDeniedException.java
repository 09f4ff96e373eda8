package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 다른 사용자의 주문에 접근할 때 발생하는 예외
 */
public class OrderAccessDeniedException extends BusinessException {
    public OrderAccessDeniedException(String orderId, String userId) {
        super(ErrorCode.O004, String.format("주문 %s 에 대한 권한이 없습니다 - userId: %s", orderId, userId));
    }
}
