package com.sparta.cinema.application.cart.usecase;

import com.sparta.cinema.application.cart.service.CartService;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 비우기 UseCase
 */
@Service
@RequiredArgsConstructor
public class ClearCartUseCase {

    private final CartService cartService;

    @Trace
    @DistributedLock(key = "'cart:user:' + #userId")
    public void execute(String userId) {
        cartService.clear(userId);
    }
}
