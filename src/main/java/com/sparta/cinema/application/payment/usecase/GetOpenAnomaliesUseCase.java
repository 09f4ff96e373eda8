package com.sparta.cinema.application.payment.usecase;

import com.sparta.cinema.application.payment.dto.PaymentAnomalyResponse;
import com.sparta.cinema.domain.payment.repository.PaymentAnomalyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 미해결 결제 이상 목록 조회 UseCase (관리자)
 */
@Service
@RequiredArgsConstructor
public class GetOpenAnomaliesUseCase {

    private final PaymentAnomalyRepository paymentAnomalyRepository;

    @Transactional(readOnly = true)
    public List<PaymentAnomalyResponse> execute() {
        return paymentAnomalyRepository.findByResolvedFalseOrderByDetectedAtDesc().stream()
                .map(PaymentAnomalyResponse::from)
                .toList();
    }
}
