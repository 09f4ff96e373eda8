package com.sparta.cinema.application.cart.usecase;

import com.sparta.cinema.application.cart.dto.CartItemResponse;
import com.sparta.cinema.application.cart.dto.CartResponse;
import com.sparta.cinema.application.cart.service.CartService;
import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.movie.entity.Movie;
import com.sparta.cinema.domain.movie.repository.MovieRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetCartUseCase {

    private final CartService cartService;
    private final MovieRepository movieRepository;

    @Transactional(readOnly = true)
    public CartResponse execute(String userId) {
        // 1. 담은 순서대로 항목 조회
        List<CartItem> cartItems = cartService.snapshot(userId);

        // 2. 현재 카탈로그 정보를 한 번에 조회
        Map<String, Movie> movies = movieRepository.findAllById(
                        cartItems.stream().map(CartItem::getMovieId).toList()).stream()
                .collect(Collectors.toMap(Movie::getMovieId, Function.identity()));

        // 3. 응답 생성
        List<CartItemResponse> items = cartItems.stream()
                .map(item -> {
                    Movie movie = movies.get(item.getMovieId());
                    return movie != null ? CartItemResponse.from(item, movie) : CartItemResponse.missing(item);
                })
                .toList();

        return CartResponse.of(userId, items);
    }
}
