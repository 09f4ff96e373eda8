package com.sparta.cinema.domain.payment.repository;

import com.sparta.cinema.domain.payment.entity.PaymentAnomaly;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * 결제 이상 기록 Repository 인터페이스
 */
public interface PaymentAnomalyRepository extends JpaRepository<PaymentAnomaly, String> {

    List<PaymentAnomaly> findByResolvedFalseOrderByDetectedAtDesc();

    List<PaymentAnomaly> findByOrderId(String orderId);
}
