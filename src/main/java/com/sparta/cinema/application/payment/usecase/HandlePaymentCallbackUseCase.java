package com.sparta.cinema.application.payment.usecase;

import com.sparta.cinema.application.payment.dto.CallbackResult;
import com.sparta.cinema.application.payment.dto.PaymentCallbackRequest;
import com.sparta.cinema.application.payment.dto.PaymentCallbackResponse;
import com.sparta.cinema.application.payment.service.PaymentCallbackService;
import com.sparta.cinema.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 결제 콜백 유스케이스
 *
 * 같은 eventId가 동시에 두 번 들어오면 늦은 쪽은 processed_messages PK 충돌로 롤백된다.
 * 이 경우 먼저 들어온 쪽이 처리했으므로 DUPLICATE로 응답한다.
 */
@Service
@RequiredArgsConstructor
public class HandlePaymentCallbackUseCase {

    private final PaymentCallbackService paymentCallbackService;

    @Trace
    public PaymentCallbackResponse execute(PaymentCallbackRequest request) {
        CallbackResult result;
        try {
            result = paymentCallbackService.handle(request);
        } catch (DataIntegrityViolationException e) {
            result = CallbackResult.DUPLICATE;
        }
        return new PaymentCallbackResponse(request.eventId(), result);
    }
}
