package com.sparta.cinema.application.cart.usecase;

import com.sparta.cinema.application.cart.dto.CartItemResponse;
import com.sparta.cinema.application.cart.service.CartService;
import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 항목 수량 변경 UseCase
 */
@Service
@RequiredArgsConstructor
public class UpdateCartItemUseCase {

    private final CartService cartService;
    private final MovieRepository movieRepository;

    @Trace
    @DistributedLock(key = "'cart:user:' + #userId")
    public CartItemResponse execute(String userId, String movieId, int quantity) {
        CartItem item = cartService.changeQuantity(userId, movieId, quantity);

        return movieRepository.findById(movieId)
                .map(movie -> CartItemResponse.from(item, movie))
                .orElseGet(() -> CartItemResponse.missing(item));
    }
}
