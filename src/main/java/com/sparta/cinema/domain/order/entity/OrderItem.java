package com.sparta.cinema.domain.order.entity;

import com.sparta.cinema.domain.movie.CatalogItem;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 주문 항목 엔티티
 * 체크아웃 시점의 제목과 가격을 복사해 둔 스냅샷. 생성 후 변경되지 않는다.
 */
@Entity
@Table(name = "order_items", indexes = {
        @Index(name = "idx_order_items_order_id", columnList = "order_id"),
        @Index(name = "idx_order_items_movie_id", columnList = "movie_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OrderItem {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String orderItemId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "movie_id", nullable = false)
    private String movieId;

    @Column(name = "movie_title", nullable = false)
    private String movieTitle;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    public static OrderItem snapshot(String orderId, CatalogItem catalogItem, int quantity) {
        return OrderItem.builder()
                .orderId(orderId)
                .movieId(catalogItem.itemId())
                .movieTitle(catalogItem.title())
                .unitPrice(catalogItem.price())
                .quantity(quantity)
                .subtotal(catalogItem.price().multiply(BigDecimal.valueOf(quantity)))
                .build();
    }
}
