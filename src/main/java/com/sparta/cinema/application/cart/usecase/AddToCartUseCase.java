package com.sparta.cinema.application.cart.usecase;

import com.sparta.cinema.application.cart.dto.AddToCartRequest;
import com.sparta.cinema.application.cart.dto.CartItemResponse;
import com.sparta.cinema.application.cart.service.CartService;
import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.movie.exception.MovieNotFoundException;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import com.sparta.cinema.infrastructure.aop.annotation.DistributedLock;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 담기 UseCase
 *
 * 락 키: "lock:cart:user:{userId}"
 * 같은 사용자의 장바구니 변경과 체크아웃은 같은 락으로 직렬화된다
 */
@Service
@RequiredArgsConstructor
public class AddToCartUseCase {

    private final CartService cartService;
    private final MovieRepository movieRepository;

    @Trace
    @DistributedLock(key = "'cart:user:' + #request.userId")
    public CartItemResponse execute(AddToCartRequest request) {
        CartItem item = cartService.addItem(request.userId(), request.movieId(), request.quantity());

        return movieRepository.findById(item.getMovieId())
                .map(movie -> CartItemResponse.from(item, movie))
                .orElseThrow(() -> new MovieNotFoundException(item.getMovieId()));
    }
}
