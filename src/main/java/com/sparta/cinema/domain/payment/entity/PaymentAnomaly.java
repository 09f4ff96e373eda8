package com.sparta.cinema.domain.payment.entity;

import com.sparta.cinema.domain.payment.AnomalyType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 결제 이상 기록
 * 자동 환불하지 않고 운영자가 확인할 때까지 남겨 둔다
 */
@Entity
@Table(name = "payment_anomalies", indexes = {
        @Index(name = "idx_payment_anomalies_order_id", columnList = "order_id"),
        @Index(name = "idx_payment_anomalies_resolved", columnList = "resolved")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PaymentAnomaly {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String anomalyId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "attempt_id", nullable = false)
    private String attemptId;

    @Column(name = "type", nullable = false)
    @Enumerated(EnumType.STRING)
    private AnomalyType type;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "resolved", nullable = false)
    @Builder.Default
    private boolean resolved = false;

    @Column(name = "detected_at", nullable = false)
    private LocalDateTime detectedAt;

    @PrePersist
    protected void onCreate() {
        if (this.detectedAt == null) {
            this.detectedAt = LocalDateTime.now();
        }
    }
}
