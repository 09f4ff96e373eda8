package com.sparta.cinema.domain.payment.repository;

import com.sparta.cinema.domain.payment.PaymentAttemptStatus;
import com.sparta.cinema.domain.payment.entity.PaymentAttempt;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 결제 시도 Repository 인터페이스
 */
public interface PaymentAttemptRepository extends JpaRepository<PaymentAttempt, String> {

    // 콜백 위치 확인용 ID 조회. 엔티티를 영속성 컨텍스트에 올리지 않으므로 주문 잠금 이후 findByIdWithLock으로 최신 상태를 읽는다

    @Query("SELECT a.attemptId FROM PaymentAttempt a WHERE a.gatewayReference = :gatewayReference")
    Optional<String> findAttemptIdByGatewayReference(@Param("gatewayReference") String gatewayReference);

    @Query("SELECT a.attemptId FROM PaymentAttempt a WHERE a.idempotencyKey = :idempotencyKey")
    Optional<String> findAttemptIdByIdempotencyKey(@Param("idempotencyKey") String idempotencyKey);

    @Query("SELECT a.orderId FROM PaymentAttempt a WHERE a.attemptId = :attemptId")
    Optional<String> findOrderIdByAttemptId(@Param("attemptId") String attemptId);

    /**
     * 비관적 락(FOR UPDATE)으로 시도 조회
     * 잠금 읽기는 트랜잭션 스냅샷이 아니라 커밋된 최신 행을 돌려준다. 항상 주문 잠금 다음에 호출한다
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM PaymentAttempt a WHERE a.attemptId = :attemptId")
    Optional<PaymentAttempt> findByIdWithLock(@Param("attemptId") String attemptId);

    List<PaymentAttempt> findByOrderIdOrderBySequenceAsc(String orderId);

    List<PaymentAttempt> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * 주문의 진행 중(PENDING) 결제 시도. 주문당 최대 한 건
     */
    Optional<PaymentAttempt> findFirstByOrderIdAndStatusOrderBySequenceDesc(String orderId, PaymentAttemptStatus status);

    Optional<PaymentAttempt> findFirstByOrderIdAndStatus(String orderId, PaymentAttemptStatus status);

    boolean existsByOrderIdAndStatusAndAttemptIdNot(String orderId, PaymentAttemptStatus status, String attemptId);

    /**
     * 오래 머물러 있는 PENDING 시도 (대사 대상)
     */
    @Query("SELECT a FROM PaymentAttempt a " +
            "WHERE a.status = com.sparta.cinema.domain.payment.PaymentAttemptStatus.PENDING " +
            "AND a.createdAt <= :staleBefore " +
            "AND (a.nextReconcileAt IS NULL OR a.nextReconcileAt <= :now) " +
            "ORDER BY a.createdAt ASC")
    List<PaymentAttempt> findStalePending(@Param("staleBefore") LocalDateTime staleBefore,
                                          @Param("now") LocalDateTime now,
                                          Pageable pageable);
}
