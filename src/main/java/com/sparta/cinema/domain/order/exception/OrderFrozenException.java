package com.sparta.cinema.domain.order.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 수동 검토를 위해 동결된 주문에 상태 변경을 요청할 때 발생하는 예외
 */
public class OrderFrozenException extends BusinessException {
    public OrderFrozenException(String orderId) {
        super(ErrorCode.O007, "수동 검토 중인 주문입니다: " + orderId);
    }
}
