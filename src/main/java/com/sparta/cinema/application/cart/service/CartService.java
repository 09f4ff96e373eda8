package com.sparta.cinema.application.cart.service;

import com.sparta.cinema.domain.cart.entity.Cart;
import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.cart.exception.CartItemNotFoundException;
import com.sparta.cinema.domain.cart.repository.CartItemRepository;
import com.sparta.cinema.domain.cart.repository.CartRepository;
import com.sparta.cinema.domain.movie.CatalogItem;
import com.sparta.cinema.domain.movie.CatalogService;
import com.sparta.cinema.domain.movie.exception.ItemAlreadyPurchasedException;
import com.sparta.cinema.domain.movie.exception.ItemUnavailableException;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * 장바구니 트랜잭션 처리 서비스
 * 장바구니 UseCase가 사용자별 분산 락을 잡은 뒤 호출한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final OrderItemRepository orderItemRepository;
    private final CatalogService catalogService;

    /**
     * 영화 담기. 이미 담긴 영화면 수량만 늘린다.
     */
    @Transactional
    public CartItem addItem(String userId, String movieId, int quantity) {
        CatalogItem catalogItem = catalogService.getItem(movieId);
        if (!catalogItem.available()) {
            throw new ItemUnavailableException(movieId);
        }
        if (orderItemRepository.existsByUserIdAndMovieIdAndOrderStatusIn(
                userId, movieId, EnumSet.of(OrderStatus.PAID))) {
            throw new ItemAlreadyPurchasedException(movieId);
        }

        Cart cart = cartRepository.findByUserId(userId)
                .orElseGet(() -> cartRepository.save(Cart.builder().userId(userId).build()));

        Optional<CartItem> existing = cartItemRepository.findByCartIdAndMovieId(cart.getCartId(), movieId);
        if (existing.isPresent()) {
            CartItem item = existing.get();
            item.addQuantity(quantity);
            log.info("[Cart] 수량 증가 - userId: {}, movieId: {}, quantity: {}", userId, movieId, item.getQuantity());
            return item;
        }

        CartItem saved = cartItemRepository.save(CartItem.create(cart.getCartId(), movieId, quantity));
        log.info("[Cart] 영화 담기 - userId: {}, movieId: {}, quantity: {}", userId, movieId, quantity);
        return saved;
    }

    @Transactional
    public CartItem changeQuantity(String userId, String movieId, int quantity) {
        CartItem item = findItem(userId, movieId);
        item.changeQuantity(quantity);
        return item;
    }

    @Transactional
    public void removeItem(String userId, String movieId) {
        CartItem item = findItem(userId, movieId);
        cartItemRepository.delete(item);
        log.info("[Cart] 영화 삭제 - userId: {}, movieId: {}", userId, movieId);
    }

    @Transactional
    public void clear(String userId) {
        cartRepository.findByUserId(userId)
                .ifPresent(cart -> cartItemRepository.deleteAllByCartId(cart.getCartId()));
    }

    /**
     * 담은 순서대로 항목 조회. 장바구니가 없으면 빈 목록
     */
    @Transactional(readOnly = true)
    public List<CartItem> snapshot(String userId) {
        return cartRepository.findByUserId(userId)
                .map(cart -> cartItemRepository.findByCartIdOrderByAddedAtAsc(cart.getCartId()))
                .orElse(List.of());
    }

    private CartItem findItem(String userId, String movieId) {
        return cartRepository.findByUserId(userId)
                .flatMap(cart -> cartItemRepository.findByCartIdAndMovieId(cart.getCartId(), movieId))
                .orElseThrow(() -> new CartItemNotFoundException(movieId));
    }
}
