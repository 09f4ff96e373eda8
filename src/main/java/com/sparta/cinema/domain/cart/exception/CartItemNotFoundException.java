package com.sparta.cinema.domain.cart.exception;

import com.sparta.cinema.common.exception.BusinessException;
import com.sparta.cinema.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외
 */
public class CartItemNotFoundException extends BusinessException {
    public CartItemNotFoundException(String movieId) {
        super(ErrorCode.CART002, "장바구니에 없는 영화입니다: " + movieId);
    }
}
