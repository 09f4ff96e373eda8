package com.sparta.cinema.infrastructure.outbox.repository;

import com.sparta.cinema.infrastructure.outbox.EventStatus;
import com.sparta.cinema.infrastructure.outbox.entity.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * 발행 대기 중이고 재시도 시간이 된 이벤트 조회 (오래된 순)
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.status = :status AND e.nextRetryAt <= :now ORDER BY e.id ASC")
    List<OutboxEvent> findReadyToPublish(
            @Param("status") EventStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    List<OutboxEvent> findByOrderIdOrderByIdAsc(String orderId);

    @Modifying
    @Query("DELETE FROM OutboxEvent e WHERE e.status = :status AND e.publishedAt < :cutoffDate")
    int deletePublishedBefore(@Param("status") EventStatus status, @Param("cutoffDate") LocalDateTime cutoffDate);
}
