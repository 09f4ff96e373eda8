package com.sparta.cinema.domain.order.repository;

import com.sparta.cinema.domain.order.OrderStatus;
import com.sparta.cinema.domain.order.entity.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 주문 Repository 인터페이스
 */
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 주문 조회
     * 모든 상태 전이는 이 메서드로 주문을 읽은 트랜잭션 안에서 수행한다
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") String orderId);

    /**
     * 사용자 주문 목록 (최신순)
     */
    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * 관리자 주문 검색. null 조건은 무시한다.
     */
    @Query("SELECT o FROM Order o " +
            "WHERE (:userId IS NULL OR o.userId = :userId) " +
            "AND (:status IS NULL OR o.status = :status) " +
            "AND (:from IS NULL OR o.createdAt >= :from) " +
            "AND (:to IS NULL OR o.createdAt < :to) " +
            "ORDER BY o.createdAt DESC")
    List<Order> search(@Param("userId") String userId,
                       @Param("status") OrderStatus status,
                       @Param("from") LocalDateTime from,
                       @Param("to") LocalDateTime to);
}
