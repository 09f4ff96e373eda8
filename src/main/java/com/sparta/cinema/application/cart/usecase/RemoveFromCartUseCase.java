package com.sparta.cinema.application.cart.usecase;

import com.sparta.cinema.application.cart.service.CartService;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 항목 삭제 UseCase
 */
@Service
@RequiredArgsConstructor
public class RemoveFromCartUseCase {

    private final CartService cartService;

    @Trace
    @DistributedLock(key = "'cart:user:' + #userId")
    public void execute(String userId, String movieId) {
        cartService.removeItem(userId, movieId);
    }
}
