package com.sparta.cinema.application.order.service;

import com.sparta.cinema.domain.cart.entity.Cart;
import com.sparta.cinema.domain.cart.entity.CartItem;
import com.sparta.cinema.domain.cart.exception.EmptyCartException;
import com.sparta.cinema.domain.cart.repository.CartItemRepository;
import com.sparta.cinema.domain.cart.repository.CartRepository;
import com.sparta.cinema.domain.movie.CatalogItem;
import com.sparta.cinema.domain.movie.CatalogService;
import com.sparta.cinema.domain.movie.exception.ItemAlreadyPurchasedException;
import com.sparta.cinema.domain.movie.exception.ItemUnavailableException;
import com.sparta.cinema.domain.movie.exception.MovieNotFoundException;
import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import com.sparta.cinema.domain.order.entity.OrderItem;
import com.sparta.cinema.domain.order.exception.OrderAlreadyPendingException;
import com.sparta.cinema.domain.order.repository.OrderItemRepository;
import com.sparta.cinema.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 체크아웃 트랜잭션 처리 서비스
 * CheckoutUseCase에서 사용자 장바구니 락 획득 후 호출됨
 *
 * 주문 생성과 장바구니 비우기는 한 트랜잭션으로 처리된다.
 * 검증에 하나라도 실패하면 주문은 만들어지지 않고 장바구니도 그대로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final CatalogService catalogService;

    @Transactional
    public CheckoutResult checkout(String userId) {
        // 1. 장바구니 확인
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new EmptyCartException(userId));
        List<CartItem> cartItems = cartItemRepository.findByCartIdOrderByAddedAtAsc(cart.getCartId());
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(userId);
        }

        // 2. 카탈로그에서 현재 가격과 판매 여부 재조회
        List<PricedLine> lines = new ArrayList<>();
        for (CartItem cartItem : cartItems) {
            CatalogItem catalogItem = fetchPurchasable(cartItem.getMovieId());
            validateNotOwnedOrPending(userId, cartItem.getMovieId());
            lines.add(new PricedLine(catalogItem, cartItem.getQuantity()));
        }

        // 3. 주문 생성 (가격 스냅샷)
        BigDecimal totalAmount = lines.stream()
                .map(line -> line.catalogItem().price().multiply(BigDecimal.valueOf(line.quantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);

        Order order = orderRepository.save(Order.draft(userId, totalAmount));
        List<OrderItem> orderItems = orderItemRepository.saveAll(lines.stream()
                .map(line -> OrderItem.snapshot(order.getOrderId(), line.catalogItem(), line.quantity()))
                .toList());

        // 4. 장바구니 비우기
        cartItemRepository.deleteAllByCartId(cart.getCartId());

        log.info("[Checkout] 주문 생성 - orderId: {}, userId: {}, items: {}, totalAmount: {}",
                order.getOrderId(), userId, orderItems.size(), totalAmount);

        return new CheckoutResult(order, orderItems);
    }

    private CatalogItem fetchPurchasable(String movieId) {
        CatalogItem catalogItem;
        try {
            catalogItem = catalogService.getItem(movieId);
        } catch (MovieNotFoundException e) {
            throw new ItemUnavailableException(movieId);
        }

        if (!catalogItem.available()) {
            throw new ItemUnavailableException(movieId);
        }
        return catalogItem;
    }

    private void validateNotOwnedOrPending(String userId, String movieId) {
        if (orderItemRepository.existsByUserIdAndMovieIdAndOrderStatusIn(
                userId, movieId, EnumSet.of(OrderStatus.PAID))) {
            throw new ItemAlreadyPurchasedException(movieId);
        }
        if (orderItemRepository.existsByUserIdAndMovieIdAndOrderStatusIn(
                userId, movieId, OrderStatus.openStatuses())) {
            throw new OrderAlreadyPendingException(movieId);
        }
    }

    private record PricedLine(CatalogItem catalogItem, int quantity) {
    }

    public record CheckoutResult(Order order, List<OrderItem> orderItems) {
    }
}
