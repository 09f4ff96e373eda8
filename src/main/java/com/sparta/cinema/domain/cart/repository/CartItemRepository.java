package com.sparta.cinema.domain.cart.repository;

import com.sparta.cinema.domain.cart.entity.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 장바구니 항목 Repository 인터페이스
 */
public interface CartItemRepository extends JpaRepository<CartItem, String> {

    /**
     * 담은 순서대로 항목 조회
     */
    List<CartItem> findByCartIdOrderByAddedAtAsc(String cartId);

    /**
     * 장바구니 ID와 영화 ID로 항목 조회 (중복 체크용)
     */
    Optional<CartItem> findByCartIdAndMovieId(String cartId, String movieId);

    /**
     * 장바구니의 모든 항목 삭제 (장바구니 비우기)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CartItem ci WHERE ci.cartId = :cartId")
    int deleteAllByCartId(@Param("cartId") String cartId);
}
