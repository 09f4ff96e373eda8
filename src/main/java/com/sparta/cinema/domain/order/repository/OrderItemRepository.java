package com.sparta.cinema.domain.order.repository;

import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * 주문 항목 Repository 인터페이스
 */
public interface OrderItemRepository extends JpaRepository<OrderItem, String> {

    List<OrderItem> findByOrderId(String orderId);

    List<OrderItem> findByOrderIdIn(Collection<String> orderIds);

    /**
     * 사용자의 주어진 상태 주문 중 해당 영화가 포함된 것이 있는지
     * - PAID: 이미 구매한 영화
     * - DRAFT/AWAITING_PAYMENT/PAYMENT_FAILED: 결제 대기 중인 영화
     */
    @Query("SELECT COUNT(oi) > 0 FROM OrderItem oi, Order o " +
            "WHERE oi.orderId = o.orderId " +
            "AND o.userId = :userId " +
            "AND oi.movieId = :movieId " +
            "AND o.status IN :statuses")
    boolean existsByUserIdAndMovieIdAndOrderStatusIn(@Param("userId") String userId,
                                                     @Param("movieId") String movieId,
                                                     @Param("statuses") Collection<OrderStatus> statuses);
}
