package com.sparta.cinema.domain.cart.entity;

import com.sparta.cinema.domain.cart.exception.InvalidQuantityException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 장바구니 항목 엔티티
 * 장바구니 하나에 같은 영화는 한 줄만 존재한다
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_items_cart_movie", columnNames = {"cart_id", "movie_id"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CartItem {

    public static final int MAX_QUANTITY = 99;

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String cartItemId;

    @Column(name = "cart_id", nullable = false)
    private String cartId;

    @Column(name = "movie_id", nullable = false)
    private String movieId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;

    @PrePersist
    protected void onCreate() {
        if (this.addedAt == null) {
            this.addedAt = LocalDateTime.now();
        }
    }

    public static CartItem create(String cartId, String movieId, int quantity) {
        validateQuantity(quantity);
        return CartItem.builder()
                .cartId(cartId)
                .movieId(movieId)
                .quantity(quantity)
                .addedAt(LocalDateTime.now())
                .build();
    }

    /**
     * 수량 변경
     */
    public void changeQuantity(int newQuantity) {
        validateQuantity(newQuantity);
        this.quantity = newQuantity;
    }

    /**
     * 수량 증가. 합계가 MAX_QUANTITY를 넘으면 담지 않는다
     */
    public void addQuantity(int additionalQuantity) {
        validateQuantity(additionalQuantity);
        long total = (long) this.quantity + additionalQuantity;
        if (total > MAX_QUANTITY) {
            throw new InvalidQuantityException(total);
        }
        this.quantity = (int) total;
    }

    private static void validateQuantity(int quantity) {
        if (quantity < 1 || quantity > MAX_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
