package com.sparta.cinema.application.payment.usecase;

import com.sparta.cinema.application.payment.dto.PaymentAttemptResponse;
import com.sparta.cinema.domain.payment.repository.PaymentAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 사용자 결제 이력 조회 UseCase (최신순)
 */
@Service
@RequiredArgsConstructor
public class GetPaymentsUseCase {

    private final PaymentAttemptRepository paymentAttemptRepository;

    @Transactional(readOnly = true)
    public List<PaymentAttemptResponse> execute(String userId) {
        return paymentAttemptRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(PaymentAttemptResponse::from)
                .toList();
    }
}
