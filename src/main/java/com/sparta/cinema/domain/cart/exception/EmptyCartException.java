package com.sparta.cinema.domain.cart.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 장바구니가 비어 있는 상태로 주문을 생성할 때 발생하는 예외
 */
public class EmptyCartException extends BusinessException {
    public EmptyCartException(String userId) {
        super(ErrorCode.CART001, "장바구니가 비어있습니다: " + userId);
    }
}
